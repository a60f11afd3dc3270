package com.commodityforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class AnalysisRequest {

    @NotEmpty(message = "series must not be empty")
    @Size(max = 12, message = "at most 12 series per request")
    List<@Valid @NotNull SeriesPayload> series;

    @NotBlank(message = "target is required")
    String target;

    @Min(value = 1, message = "horizon must be >= 1")
    @Max(value = 365, message = "horizon must be <= 365")
    @Builder.Default
    int horizon = 30;

    @PositiveOrZero(message = "exposure must be >= 0")
    double exposure;

    @Positive(message = "demandRate must be > 0")
    double demandRate;

    @Builder.Default
    List<@NotNull @Min(value = 1, message = "candidate lags must be >= 1") Integer> candidateLags = List.of(1, 2, 3, 4);

    @Builder.Default
    List<@Valid @NotNull SupplierQuoteRequest> suppliers = List.of();

    /** Optional; without it the order is bounded by the configured quantities only. */
    @Valid
    InventoryRequest inventory;

    @Valid
    AnalysisOverrides overrides;
}
