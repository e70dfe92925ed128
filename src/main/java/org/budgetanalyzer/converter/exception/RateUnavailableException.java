package org.budgetanalyzer.converter.exception;

import org.budgetanalyzer.converter.domain.CurrencyPair;

/**
 * No rate could be resolved for a pair: the cache was empty, every rate provider failed and no
 * history exists to fall back on.
 */
public class RateUnavailableException extends ServiceException {

  private final CurrencyPair pair;
  private final String code;

  public RateUnavailableException(CurrencyPair pair, String code) {
    super("Unable to fetch exchange rate for " + pair.base() + " → " + pair.target());
    this.pair = pair;
    this.code = code;
  }

  public CurrencyPair getPair() {
    return pair;
  }

  public String getCode() {
    return code;
  }
}
