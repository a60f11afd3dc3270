package com.commodityforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class SeriesPayload {

    @NotBlank(message = "name is required")
    String name;

    @NotEmpty(message = "points must not be empty")
    List<@Valid @NotNull Observation> points;

    @Value
    @Builder
    @Jacksonized
    public static class Observation {
        @NotNull(message = "date is required")
        LocalDate date;

        @NotNull(message = "value is required")
        Double value;
    }
}
