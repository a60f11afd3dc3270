package com.commodityforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of the stand-alone stationarity, causality and factor-impact endpoints. {@code candidateLags}
 * is only read by the causality endpoint, {@code target} and {@code topFactors} only by the
 * factor-impact endpoint.
 */
@Value
@Builder
@Jacksonized
public class SeriesAnalysisRequest {

    @NotEmpty(message = "series must not be empty")
    @Size(max = 12, message = "at most 12 series per request")
    List<@Valid @NotNull SeriesPayload> series;

    @Builder.Default
    List<@NotNull @Min(value = 1, message = "candidate lags must be >= 1") Integer> candidateLags = List.of(1, 2, 3, 4);

    String target;

    @Min(value = 1, message = "topFactors must be >= 1")
    @Builder.Default
    int topFactors = 5;

    @Valid
    AnalysisOverrides overrides;
}
