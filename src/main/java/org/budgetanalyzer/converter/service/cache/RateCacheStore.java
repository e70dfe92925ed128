package org.budgetanalyzer.converter.service.cache;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.Quote;

/**
 * Short-lived store of the last resolved quote per pair.
 *
 * <p>Entries expire on their own after the configured TTL. A present entry is always considered
 * fresh.
 */
public interface RateCacheStore {

  /**
   * Reads the cached quote for a pair.
   *
   * @param pair the currency pair
   * @return the cached quote with {@code fromCache} set, or empty on a miss
   */
  Optional<Quote> get(CurrencyPair pair);

  /** Stores a rate for a pair, replacing any existing entry and restarting its TTL. */
  void set(CurrencyPair pair, BigDecimal rate, String source, Instant timestamp);

  /**
   * Remaining lifetime of the entry for a pair.
   *
   * @param pair the currency pair
   * @return remaining TTL, or empty when there is no entry
   */
  Optional<Duration> ttlRemaining(CurrencyPair pair);

  void delete(CurrencyPair pair);

  /**
   * Removes every cached rate.
   *
   * @return the number of entries removed
   */
  long clearAll();
}
