package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * {@code responses.get(h).get(i).get(j)} is the response of variable {@code i} at step {@code h}
 * to a shock in variable {@code j} at step 0.
 */
@Value
@Builder
public class ImpulseResponse {
    String modelId;
    List<String> variables;
    int steps;
    boolean orthogonalized;
    List<List<List<Double>>> responses;

    public double response(int step, String responding, String shocked) {
        return responses.get(step)
            .get(variables.indexOf(responding))
            .get(variables.indexOf(shocked));
    }
}
