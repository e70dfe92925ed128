package org.budgetanalyzer.converter.service.provider;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.converter.client.currencyapi.CurrencyApiClient;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;

/** CurrencyAPI implementation of {@link RateProvider}. The payload carries no rate timestamp. */
@Service
@Order(3)
public class CurrencyApiRateProvider extends AbstractRateProvider {

  public static final String NAME = "currencyapi";

  private final CurrencyApiClient currencyApiClient;

  public CurrencyApiRateProvider(
      CurrencyApiClient currencyApiClient, CurrencyConverterProperties properties) {
    super(NAME, properties.getProviders().getCurrencyApi());
    this.currencyApiClient = currencyApiClient;
  }

  @Override
  protected ProviderResponse doFetchRate(CurrencyPair pair) {
    var response = currencyApiClient.getLatest(pair.base(), pair.target());
    return toResponse(pair, response.rateFor(pair.target()), null);
  }
}
