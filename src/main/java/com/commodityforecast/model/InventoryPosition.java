package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Stock on hand and the storage and cover limits the order is sized against. Day counts are
 * forecast periods.
 */
@Value
@Builder(toBuilder = true)
public class InventoryPosition {
    double currentInventory;
    /** Absent when storage is unbounded. */
    Double storageCapacity;
    @Builder.Default
    int safetyStockDays = 15;
    @Builder.Default
    int leadTimeDays = 15;
    /** Cover above which stock counts as excess and below which it counts as a shortage. */
    @Builder.Default
    int targetDaysOfSupply = 45;

    public double safetyStock(double demandRate) {
        return demandRate * safetyStockDays;
    }

    public double reorderPoint(double demandRate) {
        return demandRate * (safetyStockDays + leadTimeDays);
    }

    /** Room left in storage, or {@code null} when storage is unbounded. */
    public Double headroom() {
        return storageCapacity == null ? null : storageCapacity - currentInventory;
    }
}
