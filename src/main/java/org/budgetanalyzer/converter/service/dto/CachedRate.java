package org.budgetanalyzer.converter.service.dto;

import java.math.BigDecimal;
import java.time.Instant;

/** JSON value stored in the rate cache for one pair. */
public record CachedRate(
    String baseCurrency,
    String targetCurrency,
    BigDecimal rate,
    String source,
    Instant timestamp) {}
