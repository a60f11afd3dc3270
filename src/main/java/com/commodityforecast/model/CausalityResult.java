package com.commodityforecast.model;

import com.commodityforecast.config.CausalityCorrection;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class CausalityResult {
    List<String> variables;
    List<Integer> candidateLags;
    CausalityCorrection correction;
    double significanceLevel;
    List<PairCausality> pairs;

    public Optional<PairCausality> pair(String cause, String effect) {
        return pairs.stream()
            .filter(p -> p.getCause().equals(cause) && p.getEffect().equals(effect))
            .findFirst();
    }

    @Value
    @Builder
    public static class PairCausality {
        String cause;
        String effect;
        int bestLag;
        double fStatistic;
        double rawPValue;
        double correctedPValue;
        boolean significant;
    }
}
