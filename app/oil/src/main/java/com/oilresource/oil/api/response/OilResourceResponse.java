package com.oilresource.oil.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oilresource.oil.model.OilResourceRecord;
import com.oilresource.oil.model.OilType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OilResourceResponse(
    UUID id,
    LocalDate date,
    BigDecimal price,
    OilType type,
    String oilDocumentUrl,
    String userId,
    String email,
    Instant createdAt,
    Instant updatedAt) {

  public static OilResourceResponse from(OilResourceRecord record) {
    return new OilResourceResponse(
        record.id(),
        record.date(),
        record.price(),
        record.type(),
        record.oilDocumentUrl(),
        record.userId(),
        record.email(),
        record.createdAt(),
        record.updatedAt());
  }
}
