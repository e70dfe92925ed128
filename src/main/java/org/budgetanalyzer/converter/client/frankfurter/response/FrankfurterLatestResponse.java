package org.budgetanalyzer.converter.client.frankfurter.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of the Frankfurter {@code /latest} endpoint. Frankfurter publishes ECB reference rates
 * once per working day, so the only time information is the date.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FrankfurterLatestResponse(
    BigDecimal amount, String base, LocalDate date, Map<String, BigDecimal> rates) {

  public BigDecimal rateFor(String currencyCode) {
    return rates == null ? null : rates.get(currencyCode);
  }
}
