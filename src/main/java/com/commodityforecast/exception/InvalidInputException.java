package com.commodityforecast.exception;

import java.util.Map;

public class InvalidInputException extends CommodityAnalysisException {
    public InvalidInputException(String stage, String message, Map<String, ?> parameters) {
        super("INVALID_INPUT", stage, message, parameters);
    }
    public InvalidInputException(String stage, String message, Map<String, ?> parameters, Throwable cause) {
        super("INVALID_INPUT", stage, message, parameters, cause);
    }
}
