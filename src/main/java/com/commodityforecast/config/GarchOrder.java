package com.commodityforecast.config;

/**
 * @param p number of ARCH (squared shock) lags
 * @param q number of GARCH (lagged variance) lags
 */
public record GarchOrder(int p, int q) {

    public static GarchOrder of(int p, int q) {
        return new GarchOrder(p, q);
    }

    @Override
    public String toString() {
        return "GARCH(" + p + "," + q + ")";
    }
}
