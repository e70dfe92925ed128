package org.budgetanalyzer.converter.service.provider;

import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;

/**
 * Interface for external exchange rate data providers.
 *
 * <p>This abstraction decouples the rate resolution logic from any specific rate API. Beans are
 * ordered with {@link org.springframework.core.annotation.Order}, which defines both the
 * aggregation label order and the priority used by the fallback strategy.
 */
public interface RateProvider {

  /**
   * Short provider name used as the quote source, e.g. {@code fixer}.
   *
   * @return the provider name
   */
  String getName();

  /**
   * Whether the provider is enabled in configuration. Disabled providers are never consulted.
   *
   * @return true if the provider takes part in resolution
   */
  boolean isEnabled();

  /**
   * Fetches the current rate for a pair.
   *
   * <p>Implementations never throw: network errors, timeouts, unusable payloads and missing
   * credentials are reported as {@link ProviderResponse#failure}.
   *
   * @param pair the normalized currency pair
   * @return a success with a positive rate, or a failure with its reason
   */
  ProviderResponse fetchRate(CurrencyPair pair);
}
