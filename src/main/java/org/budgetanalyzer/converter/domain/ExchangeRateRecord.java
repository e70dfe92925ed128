package org.budgetanalyzer.converter.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * A resolved exchange rate as recorded in the history table.
 *
 * <p>Rows are append-only: the service inserts one row per successful live resolution and never
 * updates it afterwards. The only deletion path is the retention purge, which removes rows by
 * age.
 *
 * <p>The most recent row for a pair is the stale fallback served when every rate provider is
 * failing.
 */
@Entity
@Table(
    name = "exchange_rate_history",
    indexes = {
      @Index(
          name = "idx_exchange_rate_history_pair_created",
          columnList = "base_currency, target_currency, created_at"),
      @Index(name = "idx_exchange_rate_history_created", columnList = "created_at")
    })
public class ExchangeRateRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "base_currency", nullable = false, length = 3)
  private String baseCurrency;

  @NotNull
  @Column(name = "target_currency", nullable = false, length = 3)
  private String targetCurrency;

  @NotNull
  @Positive
  @Column(nullable = false, precision = 38, scale = 28)
  private BigDecimal rate;

  /** Where the rate came from, e.g. {@code fixer} or {@code aggregated(fixer+frankfurter)}. */
  @NotNull
  @Column(nullable = false, length = 100)
  private String source;

  @NotNull
  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getBaseCurrency() {
    return baseCurrency;
  }

  public void setBaseCurrency(String baseCurrency) {
    this.baseCurrency = baseCurrency;
  }

  public String getTargetCurrency() {
    return targetCurrency;
  }

  public void setTargetCurrency(String targetCurrency) {
    this.targetCurrency = targetCurrency;
  }

  public BigDecimal getRate() {
    return rate;
  }

  public void setRate(BigDecimal rate) {
    this.rate = rate;
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public CurrencyPair getPair() {
    return CurrencyPair.of(baseCurrency, targetCurrency);
  }
}
