package org.budgetanalyzer.converter.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.MeterRegistry;

import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties.ResolutionStrategy;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.exception.InvalidRequestException;
import org.budgetanalyzer.converter.exception.RateUnavailableException;
import org.budgetanalyzer.converter.service.cache.RateCacheStore;
import org.budgetanalyzer.converter.service.dto.ConversionResult;
import org.budgetanalyzer.converter.service.dto.PairSummary;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;
import org.budgetanalyzer.converter.service.dto.Quote;
import org.budgetanalyzer.converter.service.dto.RateHistory;
import org.budgetanalyzer.converter.service.history.RateHistoryStore;

/**
 * Resolves exchange rates through a three-tier chain: rate cache, live provider lookup, and the
 * most recent recorded rate as a stale fallback.
 *
 * <p>A live rate is written to the cache and appended to history before it is returned. Cache hits
 * and stale fallbacks never add history rows.
 *
 * <p>When coalescing is enabled, concurrent cache misses for the same pair share one live lookup
 * and all callers receive its result or its failure.
 */
@Service
public class RateResolver {

  private static final Logger log = LoggerFactory.getLogger(RateResolver.class);

  static final String RESOLUTIONS_METRIC = "exchange.rate.resolutions";
  static final String STALE_SUFFIX = " (stale)";
  static final String IDENTITY_SOURCE = "identity";

  private final RateCacheStore cacheStore;
  private final RateHistoryStore historyStore;
  private final RateAggregationService aggregationService;
  private final CurrencyConverterProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private final ConcurrentMap<CurrencyPair, CompletableFuture<Quote>> inFlight =
      new ConcurrentHashMap<>();

  public RateResolver(
      RateCacheStore cacheStore,
      RateHistoryStore historyStore,
      RateAggregationService aggregationService,
      CurrencyConverterProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.cacheStore = cacheStore;
    this.historyStore = historyStore;
    this.aggregationService = aggregationService;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Resolves the current rate for a pair.
   *
   * @param base base currency code, case-insensitive
   * @param target target currency code, case-insensitive
   * @return the resolved quote
   * @throws RateUnavailableException if the cache is empty, every provider fails and the pair has
   *     no recorded history
   */
  public Quote resolveRate(String base, String target) {
    var pair = CurrencyPair.of(base, target);

    if (pair.isIdentity()) {
      recordTier("identity");
      return new Quote(pair, BigDecimal.ONE, IDENTITY_SOURCE, Instant.now(clock), false);
    }

    var cached = cacheStore.get(pair);
    if (cached.isPresent()) {
      if (log.isDebugEnabled()) {
        log.debug(
            "Cache hit for {}, ttl remaining: {}",
            pair,
            cacheStore.ttlRemaining(pair).map(Duration::toSeconds).orElse(-1L));
      }
      recordTier("cache");
      return cached.get();
    }

    if (!properties.getResolution().isCoalesceConcurrentRequests()) {
      return resolveUncached(pair);
    }

    return resolveCoalesced(pair);
  }

  /**
   * Converts an amount at the current rate.
   *
   * @param base base currency code
   * @param target target currency code
   * @param amount positive amount in base currency
   * @return the quote used together with the converted amount, rounded to 2 decimal places
   * @throws IllegalArgumentException if amount is null or not positive
   * @throws RateUnavailableException if no rate can be resolved
   */
  public ConversionResult convert(String base, String target, BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("Amount must be positive");
    }

    var quote = resolveRate(base, target);
    return ConversionResult.of(quote, amount);
  }

  public RateHistory getHistory(String base, String target, int hoursBack) {
    if (hoursBack < 1) {
      throw new IllegalArgumentException("hoursBack must be at least 1");
    }

    var pair = CurrencyPair.of(base, target);
    var records = historyStore.rangeByHours(pair, hoursBack);
    return new RateHistory(pair, hoursBack + " hours", records);
  }

  public RateHistory getHistoryBetween(String base, String target, Instant start, Instant end) {
    if (start.isAfter(end)) {
      throw new InvalidRequestException("Start must not be after end");
    }

    var pair = CurrencyPair.of(base, target);
    var records = historyStore.rangeByDates(pair, start, end);
    return new RateHistory(pair, start + " to " + end, records);
  }

  public List<PairSummary> listPairs() {
    return historyStore.distinctPairs().stream()
        .map(pair -> new PairSummary(pair, historyStore.countFor(pair)))
        .toList();
  }

  public Optional<Duration> cacheTtl(String base, String target) {
    return cacheStore.ttlRemaining(CurrencyPair.of(base, target));
  }

  public void invalidate(String base, String target) {
    cacheStore.delete(CurrencyPair.of(base, target));
  }

  public long invalidateAll() {
    return cacheStore.clearAll();
  }

  public int purgeHistory(int daysToKeep) {
    if (daysToKeep < 1) {
      throw new IllegalArgumentException("daysToKeep must be at least 1");
    }

    return historyStore.purgeOlderThan(daysToKeep);
  }

  private Quote resolveCoalesced(CurrencyPair pair) {
    var future = new CompletableFuture<Quote>();
    var existing = inFlight.putIfAbsent(pair, future);

    if (existing != null) {
      log.debug("Joining in-flight resolution for {}", pair);
      try {
        return existing.join();
      } catch (CompletionException e) {
        if (e.getCause() instanceof RuntimeException cause) {
          throw cause;
        }
        throw e;
      }
    }

    try {
      var quote = resolveUncached(pair);
      future.complete(quote);
      return quote;
    } catch (RuntimeException e) {
      future.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(pair, future);
    }
  }

  private Quote resolveUncached(CurrencyPair pair) {
    var response = fetchLive(pair);

    if (response.success()) {
      var timestamp = response.timestamp() != null ? response.timestamp() : Instant.now(clock);
      cacheStore.set(pair, response.rate(), response.source(), timestamp);
      historyStore.append(pair, response.rate(), response.source());

      log.info("Resolved {} = {} from {}", pair, response.rate(), response.source());
      recordTier("live");
      return new Quote(pair, response.rate(), response.source(), timestamp, false);
    }

    var latest = historyStore.latest(pair);
    if (latest.isPresent()) {
      var record = latest.get();
      var source = record.source() + STALE_SUFFIX;

      log.warn(
          "All providers failed for {}, serving stale rate {} recorded at {}",
          pair,
          record.rate(),
          record.createdAt());

      if (properties.getResolution().isReseedCacheOnStale()) {
        cacheStore.set(pair, record.rate(), source, record.createdAt());
      }

      recordTier("stale");
      return new Quote(pair, record.rate(), source, record.createdAt(), false);
    }

    log.error("No rate available for {}: providers failed and no history exists", pair);
    recordTier("unavailable");
    throw new RateUnavailableException(pair, CurrencyConverterError.RATE_UNAVAILABLE.name());
  }

  private ProviderResponse fetchLive(CurrencyPair pair) {
    if (properties.getResolution().getStrategy() == ResolutionStrategy.FALLBACK) {
      return aggregationService.fetchRateWithFallback(pair);
    }

    return aggregationService.aggregate(pair);
  }

  private void recordTier(String tier) {
    meterRegistry.counter(RESOLUTIONS_METRIC, "tier", tier).increment();
  }
}
