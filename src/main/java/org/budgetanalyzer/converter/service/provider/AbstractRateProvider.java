package org.budgetanalyzer.converter.service.provider;

import java.math.BigDecimal;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;

/**
 * Shared failure isolation for rate providers. Subclasses implement {@link #doFetchRate} and may
 * throw freely; every exception becomes a failed {@link ProviderResponse}.
 */
public abstract class AbstractRateProvider implements RateProvider {

  private static final Logger log = LoggerFactory.getLogger(AbstractRateProvider.class);

  protected static final String MISSING_API_KEY = "API key not configured";

  private final String name;
  private final CurrencyConverterProperties.Provider config;

  protected AbstractRateProvider(String name, CurrencyConverterProperties.Provider config) {
    this.name = name;
    this.config = config;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean isEnabled() {
    return config.isEnabled();
  }

  @Override
  public ProviderResponse fetchRate(CurrencyPair pair) {
    if (requiresApiKey() && !config.hasApiKey()) {
      log.warn("Skipping {} for {}: {}", name, pair, MISSING_API_KEY);
      return ProviderResponse.failure(name, MISSING_API_KEY);
    }

    try {
      var response = doFetchRate(pair);
      if (response.success()) {
        log.debug("{} returned rate {} for {}", name, response.rate(), pair);
      } else {
        log.warn("{} failed for {}: {}", name, pair, response.failureReason());
      }
      return response;
    } catch (Exception e) {
      log.warn("{} failed for {}: {}", name, pair, e.getMessage());
      return ProviderResponse.failure(name, e.getMessage());
    }
  }

  protected abstract ProviderResponse doFetchRate(CurrencyPair pair);

  protected boolean requiresApiKey() {
    return true;
  }

  /**
   * Builds the response for a rate read from a provider payload.
   *
   * @param pair the requested pair
   * @param rate the rate found in the payload, may be null
   * @param timestamp provider-reported time of the rate, may be null
   * @return success for a positive rate, failure otherwise
   */
  protected ProviderResponse toResponse(CurrencyPair pair, BigDecimal rate, Instant timestamp) {
    if (rate == null) {
      return ProviderResponse.failure(name, "No rate for " + pair.target() + " in response");
    }
    if (rate.signum() <= 0) {
      return ProviderResponse.failure(name, "Non-positive rate " + rate.toPlainString());
    }

    return ProviderResponse.success(name, rate, timestamp);
  }
}
