package com.commodityforecast.model;

/**
 * Test-statistic thresholds at the three conventional significance levels.
 */
public record CriticalValues(double onePercent, double fivePercent, double tenPercent) {

    public double at(double significance) {
        if (significance <= 0.01) {
            return onePercent;
        }
        return significance <= 0.05 ? fivePercent : tenPercent;
    }
}
