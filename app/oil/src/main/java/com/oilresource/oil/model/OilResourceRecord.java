/*
 * どこで: Oil API ドメインモデル
 * 何を: oil_resources テーブル 1 行に相当するレコード
 * なぜ: Repository/Service/API 間で価格記録の受け渡し形を固定するため
 */
package com.oilresource.oil.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record OilResourceRecord(
    UUID id,
    LocalDate date,
    BigDecimal price,
    OilType type,
    String oilDocumentUrl,
    String userId,
    String email,
    Instant createdAt,
    Instant updatedAt) {}
