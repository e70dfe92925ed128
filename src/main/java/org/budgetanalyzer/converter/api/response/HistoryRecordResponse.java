package org.budgetanalyzer.converter.api.response;

import java.math.BigDecimal;
import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.converter.service.dto.HistoryRecord;

@Schema(description = "A recorded exchange rate")
public record HistoryRecordResponse(
    @Schema(description = "Record identifier", example = "42") Long id,
    @Schema(description = "Recorded rate", example = "0.9234") BigDecimal rate,
    @Schema(description = "Where the rate came from", example = "aggregated(fixer+frankfurter)")
        String source,
    @Schema(description = "When the rate was recorded", example = "2025-01-15T10:30:00Z")
        Instant createdAt) {

  public static HistoryRecordResponse from(HistoryRecord record) {
    return new HistoryRecordResponse(
        record.id(), record.rate(), record.source(), record.createdAt());
  }
}
