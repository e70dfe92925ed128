package org.budgetanalyzer.converter.client.currencyapi;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import org.budgetanalyzer.converter.client.AbstractRateClient;
import org.budgetanalyzer.converter.client.currencyapi.response.CurrencyApiLatestResponse;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties;

/** Client for the CurrencyAPI v3 latest-rates endpoint. Requires an API key. */
@Component
public class CurrencyApiClient extends AbstractRateClient {

  private final CurrencyConverterProperties.Provider config;

  public CurrencyApiClient(
      WebClient.Builder webClientBuilder, CurrencyConverterProperties properties) {
    super("CurrencyAPI", webClientBuilder, properties.getProviders().getCurrencyApi());
    this.config = properties.getProviders().getCurrencyApi();
  }

  public CurrencyApiLatestResponse getLatest(String baseCurrency, String targetCurrency) {
    var url =
        new StringBuilder("/v3/latest")
            .append("?apikey=")
            .append(encode(config.getApiKey()))
            .append("&base_currency=")
            .append(encode(baseCurrency))
            .append("&currencies=")
            .append(encode(targetCurrency))
            .toString();

    return get(url, CurrencyApiLatestResponse.class);
  }
}
