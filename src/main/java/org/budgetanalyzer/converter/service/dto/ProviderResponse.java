package org.budgetanalyzer.converter.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of asking one rate provider (or the aggregation of several) for a rate.
 *
 * <p>Either a success carrying a positive rate, or a failure carrying the reason. Failures never
 * carry a rate. Use {@link #success} and {@link #failure} rather than the canonical constructor.
 *
 * @param success whether a usable rate was obtained
 * @param rate the rate on success, null on failure
 * @param source provider name, aggregated label, or {@code none}
 * @param timestamp provider-reported time of the rate, null when the provider gives none
 * @param failureReason why the call failed, null on success
 */
public record ProviderResponse(
    boolean success, BigDecimal rate, String source, Instant timestamp, String failureReason) {

  /** Source label used when no provider produced a rate. */
  public static final String NO_SOURCE = "none";

  public static ProviderResponse success(String source, BigDecimal rate, Instant timestamp) {
    if (rate == null || rate.signum() <= 0) {
      throw new IllegalArgumentException("Rate must be positive for source " + source);
    }

    return new ProviderResponse(true, rate, source, timestamp, null);
  }

  public static ProviderResponse failure(String source, String failureReason) {
    return new ProviderResponse(false, null, source, null, failureReason);
  }

  public static ProviderResponse exhausted() {
    return failure(NO_SOURCE, "No rate provider returned a rate");
  }
}
