package com.commodityforecast.dto;

import com.commodityforecast.model.SupplierQuote;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SupplierQuoteRequest {

    @NotBlank(message = "name is required")
    String name;

    @Positive(message = "unitPrice must be > 0 when given")
    Double unitPrice;

    @DecimalMin(value = "-0.5", message = "pricePremium must be >= -0.5")
    @Builder.Default
    double pricePremium = 0.0;

    @PositiveOrZero(message = "logisticsCostPerUnit must be >= 0")
    @Builder.Default
    double logisticsCostPerUnit = 0.0;

    @Min(value = 0, message = "paymentTermsDays must be >= 0")
    @Builder.Default
    int paymentTermsDays = 0;

    @DecimalMin(value = "0.0", message = "reliability must be >= 0")
    @DecimalMax(value = "1.0", message = "reliability must be <= 1")
    @Builder.Default
    double reliability = 1.0;

    @DecimalMin(value = "0.0", message = "qualityScore must be >= 0")
    @DecimalMax(value = "1.0", message = "qualityScore must be <= 1")
    @Builder.Default
    double qualityScore = 1.0;

    @PositiveOrZero(message = "minOrderQuantity must be >= 0")
    @Builder.Default
    double minOrderQuantity = 0.0;

    public SupplierQuote toQuote() {
        return SupplierQuote.builder()
            .name(name)
            .unitPrice(unitPrice)
            .pricePremium(pricePremium)
            .logisticsCostPerUnit(logisticsCostPerUnit)
            .paymentTermsDays(paymentTermsDays)
            .reliability(reliability)
            .qualityScore(qualityScore)
            .minOrderQuantity(minOrderQuantity)
            .build();
    }
}
