package com.commodityforecast.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
