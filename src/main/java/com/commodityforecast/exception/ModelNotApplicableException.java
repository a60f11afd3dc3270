package com.commodityforecast.exception;

import java.util.Map;

public class ModelNotApplicableException extends CommodityAnalysisException {
    public ModelNotApplicableException(String stage, String message, Map<String, ?> parameters) {
        super("MODEL_NOT_APPLICABLE", stage, message, parameters);
    }
    public ModelNotApplicableException(String stage, String message, Map<String, ?> parameters, Throwable cause) {
        super("MODEL_NOT_APPLICABLE", stage, message, parameters, cause);
    }
}
