package com.commodityforecast.math;

import java.time.Duration;

/**
 * @param stage          pipeline stage reported when the budget is exhausted
 * @param maxEvaluations objective evaluations allowed
 * @param timeout        wall-clock allowance for the whole optimization
 */
public record OptimizationBudget(String stage, int maxEvaluations, Duration timeout) {
}
