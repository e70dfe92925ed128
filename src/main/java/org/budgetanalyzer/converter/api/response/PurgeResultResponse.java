package org.budgetanalyzer.converter.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of a history purge")
public record PurgeResultResponse(
    @Schema(description = "Retention window applied, in days", example = "30") int daysToKeep,
    @Schema(description = "Number of history records deleted", example = "1520")
        int deletedRecords) {}
