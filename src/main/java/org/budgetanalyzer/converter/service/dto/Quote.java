package org.budgetanalyzer.converter.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

import org.budgetanalyzer.converter.domain.CurrencyPair;

/**
 * A resolved exchange rate for a pair at a point in time.
 *
 * @param pair the normalized currency pair
 * @param rate units of target currency per unit of base currency, always positive
 * @param source provenance label, e.g. {@code fixer}, {@code aggregated(fixer+frankfurter)} or
 *     {@code aggregated(fixer) (stale)}
 * @param timestamp when the rate was obtained or recorded
 * @param fromCache whether the quote was served from the rate cache
 */
public record Quote(
    CurrencyPair pair, BigDecimal rate, String source, Instant timestamp, boolean fromCache) {

  public String baseCurrency() {
    return pair.base();
  }

  public String targetCurrency() {
    return pair.target();
  }
}
