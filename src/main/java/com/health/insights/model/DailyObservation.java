package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
@Schema(description = "One day's value of a metric together with a reference to the raw record it came from")
public class DailyObservation {

    @Schema(description = "Calendar date of the observation", example = "2025-03-14")
    LocalDate date;

    @Schema(description = "Observed value", example = "6.5")
    double value;

    @Schema(description = "Table of the originating raw record", example = "sleep_entries")
    String sourceTable;

    @Schema(description = "Identifier of the originating raw record", example = "6f1c2a9e-2b1d-4c55-9a4e-3f2d0c8b7e11")
    String sourceId;

    public boolean isFinite() {
        return Double.isFinite(value);
    }
}
