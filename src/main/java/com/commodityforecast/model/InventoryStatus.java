package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InventoryStatus {
    double currentInventory;
    double safetyStock;
    double reorderPoint;
    double daysOfSupply;
    double targetStock;
    double excessInventory;
    double shortage;
    /** Stock is at or below the reorder point. */
    boolean reorderNow;
    /** Absent when storage is unbounded. */
    Double availableCapacity;
}
