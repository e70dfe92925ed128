package org.budgetanalyzer.converter.client.fixer.response;

import java.math.BigDecimal;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of the Fixer {@code /latest} endpoint.
 *
 * <p>Fixer answers HTTP 200 even for failed requests; {@code success} is false and {@code error}
 * describes the problem in that case.
 *
 * @param success whether Fixer processed the request
 * @param timestamp time of the rates in epoch seconds
 * @param base base currency of the rates
 * @param date date of the rates (yyyy-MM-dd)
 * @param rates target currency code to rate
 * @param error populated when {@code success} is false
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FixerLatestResponse(
    Boolean success,
    Long timestamp,
    String base,
    String date,
    Map<String, BigDecimal> rates,
    FixerError error) {

  public boolean isSuccess() {
    return Boolean.TRUE.equals(success);
  }

  public BigDecimal rateFor(String currencyCode) {
    return rates == null ? null : rates.get(currencyCode);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FixerError(Integer code, String type, String info) {}
}
