package org.budgetanalyzer.converter.service.dto;

import java.util.List;

import org.budgetanalyzer.converter.domain.CurrencyPair;

/**
 * Recorded rates for a pair over a period, newest first.
 *
 * @param pair the currency pair
 * @param period human readable period, e.g. {@code 24 hours}
 * @param records the matching history rows, newest first
 */
public record RateHistory(CurrencyPair pair, String period, List<HistoryRecord> records) {

  public RateHistory {
    records = List.copyOf(records);
  }

  public int count() {
    return records.size();
  }
}
