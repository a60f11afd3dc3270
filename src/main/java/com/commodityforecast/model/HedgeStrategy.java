package com.commodityforecast.model;

public enum HedgeStrategy {
    NO_HEDGE,
    DYNAMIC_HEDGE,
    PARTIAL_HEDGE,
    FULL_HEDGE;

    public static HedgeStrategy forRatio(double ratio) {
        if (ratio <= 0.0) {
            return NO_HEDGE;
        }
        if (ratio < 0.5) {
            return DYNAMIC_HEDGE;
        }
        return ratio < 1.0 ? PARTIAL_HEDGE : FULL_HEDGE;
    }
}
