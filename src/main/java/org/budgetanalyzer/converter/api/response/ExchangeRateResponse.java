package org.budgetanalyzer.converter.api.response;

import java.math.BigDecimal;
import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.converter.service.dto.Quote;

/** Response DTO for a resolved exchange rate. */
@Schema(description = "Exchange rate for a currency pair")
public record ExchangeRateResponse(
    @Schema(
            description = "Base currency (ISO 4217 code)",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        String baseCurrency,
    @Schema(
            description = "Target currency (ISO 4217 code)",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String targetCurrency,
    @Schema(
            description = "Units of target currency per unit of base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0.9234")
        BigDecimal rate,
    @Schema(
            description = "Where the rate came from; stale rates are suffixed with ' (stale)'",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "aggregated(fixer+frankfurter)")
        String source,
    @Schema(
            description = "When the rate was obtained",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-01-15T10:30:00Z")
        Instant timestamp,
    @Schema(
            description = "Whether the rate was served from the cache",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "false")
        boolean fromCache) {

  public static ExchangeRateResponse from(Quote quote) {
    return new ExchangeRateResponse(
        quote.baseCurrency(),
        quote.targetCurrency(),
        quote.rate(),
        quote.source(),
        quote.timestamp(),
        quote.fromCache());
  }
}
