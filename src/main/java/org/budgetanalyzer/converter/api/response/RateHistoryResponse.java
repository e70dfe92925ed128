package org.budgetanalyzer.converter.api.response;

import java.util.List;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.converter.service.dto.RateHistory;

/** Response DTO for rate history queries. Records are ordered newest first. */
@Schema(description = "Recorded rates for a currency pair over a period")
public record RateHistoryResponse(
    @Schema(description = "Base currency", example = "USD") String baseCurrency,
    @Schema(description = "Target currency", example = "EUR") String targetCurrency,
    @Schema(description = "Period covered by the query", example = "24 hours") String period,
    @Schema(description = "Number of records returned", example = "3") int count,
    @ArraySchema(schema = @Schema(implementation = HistoryRecordResponse.class))
        List<HistoryRecordResponse> records) {

  public static RateHistoryResponse from(RateHistory history) {
    return new RateHistoryResponse(
        history.pair().base(),
        history.pair().target(),
        history.period(),
        history.count(),
        history.records().stream().map(HistoryRecordResponse::from).toList());
  }
}
