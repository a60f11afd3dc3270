package com.commodityforecast.exception;

import java.util.Map;

public class UnstableModelException extends CommodityAnalysisException {
    public UnstableModelException(String stage, String message, Map<String, ?> parameters) {
        super("UNSTABLE_MODEL", stage, message, parameters);
    }
    public UnstableModelException(String stage, String message, Map<String, ?> parameters, Throwable cause) {
        super("UNSTABLE_MODEL", stage, message, parameters, cause);
    }
}
