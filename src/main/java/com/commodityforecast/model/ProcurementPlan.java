package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProcurementPlan {
    String forecastId;
    String variable;
    OrderPlan order;
    /** Cost of buying the whole demand in one order now. */
    double baselineCost;
    double projectedSavings;
    /** Savings of the recommended timing over the best plan placed now. */
    double timingSavings;
    /** Ascending by total landed cost. */
    List<SupplierCost> suppliers;
    RiskLevel riskLevel;
    /** Absent when no inventory position was given. */
    InventoryStatus inventory;
}
