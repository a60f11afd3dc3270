package com.commodityforecast.config;

/**
 * Adjustment applied to the smallest p-value found while scanning {@code m} candidate lags.
 */
public enum CausalityCorrection {
    BONFERRONI {
        @Override
        public double adjust(double pValue, int comparisons) {
            return Math.min(1.0, pValue * comparisons);
        }
    },
    SIDAK {
        @Override
        public double adjust(double pValue, int comparisons) {
            return Math.min(1.0, 1.0 - Math.pow(1.0 - pValue, comparisons));
        }
    };

    public abstract double adjust(double pValue, int comparisons);
}
