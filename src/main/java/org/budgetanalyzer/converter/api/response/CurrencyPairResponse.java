package org.budgetanalyzer.converter.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.converter.service.dto.PairSummary;

@Schema(description = "A currency pair with recorded history")
public record CurrencyPairResponse(
    @Schema(description = "Base currency", example = "USD") String baseCurrency,
    @Schema(description = "Target currency", example = "EUR") String targetCurrency,
    @Schema(description = "Number of recorded rates", example = "128") long recordCount) {

  public static CurrencyPairResponse from(PairSummary summary) {
    return new CurrencyPairResponse(
        summary.pair().base(), summary.pair().target(), summary.recordCount());
  }
}
