package com.commodityforecast.exception;

import java.util.Map;

public class InsufficientDataException extends CommodityAnalysisException {
    public InsufficientDataException(String stage, String message, Map<String, ?> parameters) {
        super("INSUFFICIENT_DATA", stage, message, parameters);
    }
    public InsufficientDataException(String stage, String message, Map<String, ?> parameters, Throwable cause) {
        super("INSUFFICIENT_DATA", stage, message, parameters, cause);
    }
}
