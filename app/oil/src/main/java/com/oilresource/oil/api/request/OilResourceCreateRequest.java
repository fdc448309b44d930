/*
 * どこで: Oil API リクエスト DTO
 * 何を: POST /api/v1/oil の入力を定義する
 * なぜ: 価格は 0 以上、日付は必須という入力規則を境界で弾くため
 */
package com.oilresource.oil.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oilresource.oil.model.OilType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OilResourceCreateRequest(
    @NotNull LocalDate date,
    @NotNull @DecimalMin("0") BigDecimal price,
    OilType type,
    String oilDocumentUrl) {}
