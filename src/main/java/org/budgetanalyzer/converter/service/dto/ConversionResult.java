package org.budgetanalyzer.converter.service.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A quote applied to an amount.
 *
 * <p>The converted amount is rounded to two decimal places with {@link RoundingMode#HALF_UP}
 * (half away from zero).
 *
 * @param quote the quote used for the conversion
 * @param amount the amount in base currency
 * @param convertedAmount the amount in target currency
 */
public record ConversionResult(Quote quote, BigDecimal amount, BigDecimal convertedAmount) {

  public static final int CONVERTED_AMOUNT_SCALE = 2;

  public static ConversionResult of(Quote quote, BigDecimal amount) {
    var converted =
        amount.multiply(quote.rate()).setScale(CONVERTED_AMOUNT_SCALE, RoundingMode.HALF_UP);
    return new ConversionResult(quote, amount, converted);
  }
}
