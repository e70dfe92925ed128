package org.budgetanalyzer.converter.service.provider;

import java.time.Instant;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.converter.client.fixer.FixerClient;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;

/** Fixer implementation of {@link RateProvider}. Highest priority. */
@Service
@Order(1)
public class FixerRateProvider extends AbstractRateProvider {

  public static final String NAME = "fixer";

  private final FixerClient fixerClient;

  public FixerRateProvider(FixerClient fixerClient, CurrencyConverterProperties properties) {
    super(NAME, properties.getProviders().getFixer());
    this.fixerClient = fixerClient;
  }

  @Override
  protected ProviderResponse doFetchRate(CurrencyPair pair) {
    var response = fixerClient.getLatest(pair.base(), pair.target());

    if (!response.isSuccess()) {
      var error = response.error();
      var reason =
          error == null
              ? "Fixer reported an unsuccessful request"
              : "Fixer error " + error.code() + ": " + error.type();
      return ProviderResponse.failure(NAME, reason);
    }

    var timestamp =
        response.timestamp() == null ? null : Instant.ofEpochSecond(response.timestamp());
    return toResponse(pair, response.rateFor(pair.target()), timestamp);
  }
}
