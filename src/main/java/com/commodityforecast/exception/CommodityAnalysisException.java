package com.commodityforecast.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public abstract class CommodityAnalysisException extends RuntimeException {
    private final String errorCode;
    private final String stage;
    private final Map<String, Object> parameters;

    protected CommodityAnalysisException(String errorCode, String stage, String message, Map<String, ?> parameters) {
        this(errorCode, stage, message, parameters, null);
    }

    protected CommodityAnalysisException(String errorCode, String stage, String message,
                                         Map<String, ?> parameters, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.stage = stage;
        this.parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(parameters));
    }
}
