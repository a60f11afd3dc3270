package com.commodityforecast.model;

/**
 * How {@link MultivariateSeries#align} reconciles variables observed on different dates.
 */
public enum GapPolicy {
    /** Keep only dates on which every variable has an observation. */
    INNER_JOIN,
    /** Union of dates, starting once every variable has been observed, last value carried forward. */
    FORWARD_FILL
}
