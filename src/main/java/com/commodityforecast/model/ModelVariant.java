package com.commodityforecast.model;

public enum ModelVariant {
    VAR_LEVELS,
    VAR_DIFFERENCED,
    VECM,
    GARCH
}
