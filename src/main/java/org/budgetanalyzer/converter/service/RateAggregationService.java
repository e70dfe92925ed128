package org.budgetanalyzer.converter.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.converter.config.ProviderExecutorConfig;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;
import org.budgetanalyzer.converter.service.provider.RateProvider;

/**
 * Combines the enabled rate providers into a single answer for a pair.
 *
 * <p>Two strategies are offered:
 *
 * <ul>
 *   <li>{@link #aggregate}: every provider is asked concurrently and the successful rates are
 *       averaged. The call returns once all providers have settled, so its latency is bounded by
 *       the slowest provider timeout.
 *   <li>{@link #fetchRateWithFallback}: providers are asked one at a time in priority order and
 *       the first success wins.
 * </ul>
 *
 * <p>Neither strategy throws for provider failures. When nothing succeeds the result is {@link
 * ProviderResponse#exhausted()}.
 */
@Service
public class RateAggregationService {

  private static final Logger log = LoggerFactory.getLogger(RateAggregationService.class);

  static final String PROVIDER_REQUESTS_METRIC = "exchange.rate.provider.requests";
  static final String REJECTED_REASON = "Provider executor saturated";

  private final List<RateProvider> providers;
  private final Executor providerExecutor;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public RateAggregationService(
      List<RateProvider> providers,
      @Qualifier(ProviderExecutorConfig.PROVIDER_EXECUTOR) Executor providerExecutor,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.providers = providers.stream().filter(RateProvider::isEnabled).toList();
    this.providerExecutor = providerExecutor;
    this.clock = clock;
    this.meterRegistry = meterRegistry;

    log.info(
        "Rate aggregation configured with providers: {}",
        this.providers.stream().map(RateProvider::getName).toList());
  }

  /**
   * Asks every enabled provider concurrently and averages the successful rates.
   *
   * @param pair the normalized currency pair
   * @return a success labelled {@code aggregated(a+b)} with the mean rate and the current time, or
   *     {@link ProviderResponse#exhausted()} if no provider succeeded
   */
  public ProviderResponse aggregate(CurrencyPair pair) {
    var futures = new ArrayList<CompletableFuture<ProviderResponse>>(providers.size());
    for (var provider : providers) {
      futures.add(submit(provider, pair));
    }

    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

    // futures are in provider order, so the label is too
    var successes = new ArrayList<ProviderResponse>();
    for (var future : futures) {
      var response = future.join();
      recordOutcome(response);
      if (response.success()) {
        successes.add(response);
      }
    }

    if (successes.isEmpty()) {
      log.warn("All {} rate providers failed for {}", providers.size(), pair);
      return ProviderResponse.exhausted();
    }

    var sum =
        successes.stream()
            .map(ProviderResponse::rate)
            .reduce(BigDecimal.ZERO, (a, b) -> a.add(b, MathContext.DECIMAL64));
    var mean = sum.divide(BigDecimal.valueOf(successes.size()), MathContext.DECIMAL64);
    var source =
        successes.stream()
            .map(ProviderResponse::source)
            .collect(Collectors.joining("+", "aggregated(", ")"));

    log.info(
        "Aggregated rate {} for {} from {}/{} providers",
        mean,
        pair,
        successes.size(),
        providers.size());

    return ProviderResponse.success(source, mean, Instant.now(clock));
  }

  /**
   * Asks enabled providers sequentially in priority order and returns the first success.
   *
   * @param pair the normalized currency pair
   * @return the first successful provider response, or {@link ProviderResponse#exhausted()}
   */
  public ProviderResponse fetchRateWithFallback(CurrencyPair pair) {
    for (var provider : providers) {
      var response = provider.fetchRate(pair);
      recordOutcome(response);
      if (response.success()) {
        log.info("Rate {} for {} from {}", response.rate(), pair, response.source());
        return response;
      }
    }

    log.warn("No rate provider returned a rate for {}", pair);
    return ProviderResponse.exhausted();
  }

  public List<String> getProviderNames() {
    return providers.stream().map(RateProvider::getName).toList();
  }

  private CompletableFuture<ProviderResponse> submit(RateProvider provider, CurrencyPair pair) {
    try {
      return CompletableFuture.supplyAsync(() -> provider.fetchRate(pair), providerExecutor)
          .exceptionally(e -> ProviderResponse.failure(provider.getName(), describeFailure(e)));
    } catch (RejectedExecutionException e) {
      // pool and queue are full; the other providers may still answer
      log.warn("Provider {} rejected for {}: executor saturated", provider.getName(), pair);
      return CompletableFuture.completedFuture(
          ProviderResponse.failure(provider.getName(), REJECTED_REASON));
    }
  }

  private void recordOutcome(ProviderResponse response) {
    meterRegistry
        .counter(
            PROVIDER_REQUESTS_METRIC,
            "provider",
            response.source(),
            "status",
            response.success() ? "success" : "failure")
        .increment();
  }

  private static String describeFailure(Throwable e) {
    var cause = e.getCause() != null ? e.getCause() : e;
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
