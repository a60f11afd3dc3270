package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Commercial terms offered by one supplier. Without a quoted {@code unitPrice} the supplier is
 * priced at the forecast mean plus {@code pricePremium}.
 */
@Value
@Builder
public class SupplierQuote {
    String name;
    Double unitPrice;
    @Builder.Default
    double pricePremium = 0.0;
    @Builder.Default
    double logisticsCostPerUnit = 0.0;
    @Builder.Default
    int paymentTermsDays = 0;
    /** Probability of on-time, in-full delivery. */
    @Builder.Default
    double reliability = 1.0;
    @Builder.Default
    double qualityScore = 1.0;
    @Builder.Default
    double minOrderQuantity = 0.0;
}
