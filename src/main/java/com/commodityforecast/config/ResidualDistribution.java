package com.commodityforecast.config;

public enum ResidualDistribution {
    NORMAL,
    STUDENT_T
}
