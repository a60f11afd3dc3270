package com.commodityforecast.exception;

import java.util.Map;

public class NoFeasibleSolutionException extends CommodityAnalysisException {
    public NoFeasibleSolutionException(String stage, String message, Map<String, ?> parameters) {
        super("NO_FEASIBLE_SOLUTION", stage, message, parameters);
    }
    public NoFeasibleSolutionException(String stage, String message, Map<String, ?> parameters, Throwable cause) {
        super("NO_FEASIBLE_SOLUTION", stage, message, parameters, cause);
    }
}
