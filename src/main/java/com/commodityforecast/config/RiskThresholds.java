package com.commodityforecast.config;

/**
 * Annualized volatility band edges: below {@code lowUpper} is LOW, below {@code mediumUpper} is MEDIUM,
 * anything else HIGH.
 */
public record RiskThresholds(double lowUpper, double mediumUpper) {
}
