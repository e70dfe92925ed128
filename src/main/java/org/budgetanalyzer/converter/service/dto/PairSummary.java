package org.budgetanalyzer.converter.service.dto;

import org.budgetanalyzer.converter.domain.CurrencyPair;

/** A currency pair that has recorded history, with the number of recorded rates. */
public record PairSummary(CurrencyPair pair, long recordCount) {}
