package org.budgetanalyzer.converter.client.fixer;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import org.budgetanalyzer.converter.client.AbstractRateClient;
import org.budgetanalyzer.converter.client.fixer.response.FixerLatestResponse;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties;

/** Client for the Fixer latest-rates API. Requires an access key. */
@Component
public class FixerClient extends AbstractRateClient {

  private final CurrencyConverterProperties.Provider config;

  public FixerClient(WebClient.Builder webClientBuilder, CurrencyConverterProperties properties) {
    super("Fixer", webClientBuilder, properties.getProviders().getFixer());
    this.config = properties.getProviders().getFixer();
  }

  public FixerLatestResponse getLatest(String baseCurrency, String targetCurrency) {
    return get(buildLatestUrl(baseCurrency, targetCurrency), FixerLatestResponse.class);
  }

  private String buildLatestUrl(String baseCurrency, String targetCurrency) {
    return new StringBuilder("/latest")
        .append("?access_key=")
        .append(encode(config.getApiKey()))
        .append("&base=")
        .append(encode(baseCurrency))
        .append("&symbols=")
        .append(encode(targetCurrency))
        .toString();
  }
}
