package org.budgetanalyzer.converter.domain;

import java.util.Locale;

/**
 * Ordered (base, target) currency code pair used as the identity key for every rate lookup.
 *
 * <p>Codes are trimmed and upper-cased on construction so {@code usd/eur} and {@code USD/EUR}
 * resolve to the same cache entry and history rows. ISO 4217 membership is not checked here.
 *
 * @param base the currency being converted from
 * @param target the currency being converted to
 */
public record CurrencyPair(String base, String target) {

  public CurrencyPair {
    base = normalize(base, "base");
    target = normalize(target, "target");
  }

  public static CurrencyPair of(String base, String target) {
    return new CurrencyPair(base, target);
  }

  /** A pair whose base and target are the same currency always converts at 1. */
  public boolean isIdentity() {
    return base.equals(target);
  }

  @Override
  public String toString() {
    return base + "/" + target;
  }

  private static String normalize(String code, String role) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Currency code (" + role + ") must not be blank");
    }

    return code.trim().toUpperCase(Locale.ROOT);
  }
}
