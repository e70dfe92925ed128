package org.budgetanalyzer.converter.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Remaining lifetime of a cached rate")
public record CacheTtlResponse(
    @Schema(description = "Base currency", example = "USD") String baseCurrency,
    @Schema(description = "Target currency", example = "EUR") String targetCurrency,
    @Schema(description = "Whether a rate is currently cached for the pair", example = "true")
        boolean cached,
    @Schema(
            description = "Seconds until the cached rate expires, null when not cached",
            example = "245")
        Long ttlSeconds) {}
