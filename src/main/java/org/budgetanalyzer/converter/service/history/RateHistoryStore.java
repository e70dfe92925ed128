package org.budgetanalyzer.converter.service.history;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.HistoryRecord;

/** Append-only record of resolved rates per pair. Records are never updated in place. */
public interface RateHistoryStore {

  HistoryRecord append(CurrencyPair pair, BigDecimal rate, String source);

  /**
   * Most recently recorded rate for a pair. This is the stale fallback when all providers fail.
   *
   * @param pair the currency pair
   * @return the newest record, or empty if the pair has never been recorded
   */
  Optional<HistoryRecord> latest(CurrencyPair pair);

  /**
   * Records created within the last {@code hoursBack} hours, newest first.
   *
   * @param pair the currency pair
   * @param hoursBack size of the look-back window in hours
   * @return matching records, newest first
   */
  List<HistoryRecord> rangeByHours(CurrencyPair pair, int hoursBack);

  /** Records created between {@code start} and {@code end} inclusive, newest first. */
  List<HistoryRecord> rangeByDates(CurrencyPair pair, Instant start, Instant end);

  long countFor(CurrencyPair pair);

  /** Every pair with at least one record, ordered by base then target currency. */
  List<CurrencyPair> distinctPairs();

  /**
   * Deletes records older than the given number of days.
   *
   * @param daysToKeep records created more than this many days ago are removed
   * @return the number of removed records
   */
  int purgeOlderThan(int daysToKeep);
}
