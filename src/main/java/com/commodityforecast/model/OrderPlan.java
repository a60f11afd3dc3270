package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderPlan {
    double quantity;
    /** Horizon step at which the order is placed; 0 means now. */
    int timingStep;
    int orderCount;
    double unitPrice;
    double totalDemand;
    double orderingCost;
    double holdingCost;
    double purchaseCost;
    double totalCost;
}
