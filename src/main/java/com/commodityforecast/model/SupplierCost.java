package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Landed cost of buying the planned quantity from one supplier. Financing is negative when
 * payment terms defer the outflow.
 */
@Value
@Builder
public class SupplierCost {
    String supplier;
    double unitPrice;
    double procurementCost;
    double logisticsCost;
    double financingCost;
    double reliabilityPremium;
    double qualityAdjustment;
    double totalCost;
    double costPerUnit;
}
