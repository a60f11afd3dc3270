package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HedgeRecommendation {
    double ratio;
    double quantity;
    HedgeStrategy strategy;
    double estimatedCost;
}
