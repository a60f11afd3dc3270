package com.commodityforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point forecasts with symmetric bands for steps 0..horizon. Step 0 is the last observation.
 * The first variable is the one the downstream stages price against.
 */
@Value
@Builder
public class Forecast {
    String forecastId;
    String modelId;
    ModelVariant modelVariant;
    double confidenceLevel;
    int horizon;
    List<VariableForecast> variables;

    public VariableForecast variable(String name) {
        return variables.stream()
            .filter(v -> v.getVariable().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Forecast has no variable " + name));
    }

    public VariableForecast primary() {
        return variables.get(0);
    }

    @Value
    @Builder
    public static class VariableForecast {
        String variable;
        List<ForecastPoint> points;

        public ForecastPoint at(int step) {
            return points.get(step);
        }

        /** Average point forecast over steps 1..horizon, or the last observation for horizon 0. */
        public double meanPoint() {
            if (points.size() == 1) {
                return points.get(0).point();
            }
            return points.subList(1, points.size()).stream()
                .mapToDouble(ForecastPoint::point)
                .average()
                .orElseThrow();
        }
    }

    public record ForecastPoint(int step, double point, double lower, double upper) {

        public double width() {
            return upper - lower;
        }
    }
}
