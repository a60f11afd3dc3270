package com.commodityforecast.model;

public enum SeriesKind {
    LEVEL,
    RETURN
}
