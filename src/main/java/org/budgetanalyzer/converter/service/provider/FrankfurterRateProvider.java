package org.budgetanalyzer.converter.service.provider;

import java.time.ZoneOffset;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.converter.client.frankfurter.FrankfurterClient;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;

/**
 * Frankfurter implementation of {@link RateProvider}. Keyless, so it is usually the provider that
 * keeps working when credentials are missing.
 */
@Service
@Order(2)
public class FrankfurterRateProvider extends AbstractRateProvider {

  public static final String NAME = "frankfurter";

  private final FrankfurterClient frankfurterClient;

  public FrankfurterRateProvider(
      FrankfurterClient frankfurterClient, CurrencyConverterProperties properties) {
    super(NAME, properties.getProviders().getFrankfurter());
    this.frankfurterClient = frankfurterClient;
  }

  @Override
  protected boolean requiresApiKey() {
    return false;
  }

  @Override
  protected ProviderResponse doFetchRate(CurrencyPair pair) {
    var response = frankfurterClient.getLatest(pair.base(), pair.target());

    var timestamp =
        response.date() == null ? null : response.date().atStartOfDay(ZoneOffset.UTC).toInstant();
    return toResponse(pair, response.rateFor(pair.target()), timestamp);
  }
}
