package com.oilresource.oil.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oilresource.oil.model.OilType;
import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import java.time.LocalDate;

// 部分更新。null の項目は変更しない。
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OilResourceUpdateRequest(
    LocalDate date, @DecimalMin("0") BigDecimal price, OilType type, String oilDocumentUrl) {}
