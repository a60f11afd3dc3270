package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One pipeline run: the aligned market series, the commodity to plan for, and the exposure and
 * demand the plan is sized against.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisInput {
    MultivariateSeries series;
    String target;
    int horizon;
    /** Units of the target currently exposed to price moves. */
    double exposure;
    /** Units consumed per forecast period. */
    double demandRate;
    List<Integer> candidateLags;
    @Builder.Default
    List<SupplierQuote> suppliers = List.of();
    /** Absent when stock and storage are not tracked. */
    InventoryPosition inventory;
}
