package com.commodityforecast.exception;

import java.util.Map;

public class NonConvergentFitException extends CommodityAnalysisException {
    public NonConvergentFitException(String stage, String message, Map<String, ?> parameters) {
        super("NON_CONVERGENT_FIT", stage, message, parameters);
    }
    public NonConvergentFitException(String stage, String message, Map<String, ?> parameters, Throwable cause) {
        super("NON_CONVERGENT_FIT", stage, message, parameters, cause);
    }
}
