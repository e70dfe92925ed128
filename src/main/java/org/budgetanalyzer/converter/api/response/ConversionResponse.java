package org.budgetanalyzer.converter.api.response;

import java.math.BigDecimal;
import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.converter.service.dto.ConversionResult;

/** Response DTO for an amount conversion. */
@Schema(description = "Amount converted at the current exchange rate")
public record ConversionResponse(
    @Schema(description = "Base currency", example = "USD") String baseCurrency,
    @Schema(description = "Target currency", example = "EUR") String targetCurrency,
    @Schema(description = "Rate used for the conversion", example = "0.925") BigDecimal rate,
    @Schema(description = "Amount in base currency", example = "100") BigDecimal amount,
    @Schema(
            description = "Amount in target currency, rounded half-up to 2 places",
            example = "92.50")
        BigDecimal convertedAmount,
    @Schema(description = "Where the rate came from", example = "aggregated(fixer+frankfurter)")
        String source,
    @Schema(description = "When the rate was obtained", example = "2025-01-15T10:30:00Z")
        Instant timestamp,
    @Schema(description = "Whether the rate was served from the cache", example = "true")
        boolean fromCache) {

  public static ConversionResponse from(ConversionResult result) {
    var quote = result.quote();
    return new ConversionResponse(
        quote.baseCurrency(),
        quote.targetCurrency(),
        quote.rate(),
        result.amount(),
        result.convertedAmount(),
        quote.source(),
        quote.timestamp(),
        quote.fromCache());
  }
}
