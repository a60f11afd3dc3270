package com.commodityforecast.model;

/** Bands of absolute correlation with the target. */
public enum ImpactStrength {
    VERY_STRONG,
    STRONG,
    MODERATE,
    WEAK;

    public static ImpactStrength of(double correlation) {
        double magnitude = Math.abs(correlation);
        if (magnitude > 0.7) {
            return VERY_STRONG;
        }
        if (magnitude > 0.5) {
            return STRONG;
        }
        if (magnitude > 0.3) {
            return MODERATE;
        }
        return WEAK;
    }
}
