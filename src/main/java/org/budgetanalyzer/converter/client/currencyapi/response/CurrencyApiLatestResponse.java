package org.budgetanalyzer.converter.client.currencyapi.response;

import java.math.BigDecimal;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response of the CurrencyAPI {@code /v3/latest} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CurrencyApiLatestResponse(Map<String, CurrencyValue> data) {

  public BigDecimal rateFor(String currencyCode) {
    if (data == null) {
      return null;
    }

    var value = data.get(currencyCode);
    return value == null ? null : value.value();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CurrencyValue(String code, BigDecimal value) {}
}
