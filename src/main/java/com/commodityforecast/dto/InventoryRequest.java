package com.commodityforecast.dto;

import com.commodityforecast.model.InventoryPosition;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class InventoryRequest {

    @PositiveOrZero(message = "currentInventory must be >= 0")
    double currentInventory;

    @Positive(message = "storageCapacity must be > 0 when given")
    Double storageCapacity;

    @Min(value = 0, message = "safetyStockDays must be >= 0")
    @Builder.Default
    int safetyStockDays = 15;

    @Min(value = 0, message = "leadTimeDays must be >= 0")
    @Builder.Default
    int leadTimeDays = 15;

    @Min(value = 0, message = "targetDaysOfSupply must be >= 0")
    @Builder.Default
    int targetDaysOfSupply = 45;

    public InventoryPosition toPosition() {
        return InventoryPosition.builder()
            .currentInventory(currentInventory)
            .storageCapacity(storageCapacity)
            .safetyStockDays(safetyStockDays)
            .leadTimeDays(leadTimeDays)
            .targetDaysOfSupply(targetDaysOfSupply)
            .build();
    }
}
