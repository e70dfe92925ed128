package org.budgetanalyzer.converter.service;

/** Error codes for currency converter business exceptions. */
public enum CurrencyConverterError {
  /** No cached rate, no provider rate and no recorded history for the requested pair. */
  RATE_UNAVAILABLE,
}
