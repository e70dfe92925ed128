package org.budgetanalyzer.converter.client.frankfurter;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import org.budgetanalyzer.converter.client.AbstractRateClient;
import org.budgetanalyzer.converter.client.frankfurter.response.FrankfurterLatestResponse;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties;

/** Client for the Frankfurter API (ECB reference rates). No credential needed. */
@Component
public class FrankfurterClient extends AbstractRateClient {

  public FrankfurterClient(
      WebClient.Builder webClientBuilder, CurrencyConverterProperties properties) {
    super("Frankfurter", webClientBuilder, properties.getProviders().getFrankfurter());
  }

  public FrankfurterLatestResponse getLatest(String baseCurrency, String targetCurrency) {
    var url =
        new StringBuilder("/latest")
            .append("?from=")
            .append(encode(baseCurrency))
            .append("&to=")
            .append(encode(targetCurrency))
            .toString();

    return get(url, FrankfurterLatestResponse.class);
  }
}
