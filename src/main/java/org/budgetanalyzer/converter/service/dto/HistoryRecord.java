package org.budgetanalyzer.converter.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.domain.ExchangeRateRecord;

/** Read-only view of one persisted history row. */
public record HistoryRecord(
    Long id, CurrencyPair pair, BigDecimal rate, String source, Instant createdAt) {

  public static HistoryRecord from(ExchangeRateRecord entity) {
    return new HistoryRecord(
        entity.getId(),
        entity.getPair(),
        entity.getRate(),
        entity.getSource(),
        entity.getCreatedAt());
  }
}
