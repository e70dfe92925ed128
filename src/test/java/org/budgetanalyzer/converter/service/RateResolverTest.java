package org.budgetanalyzer.converter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.config.CurrencyConverterProperties.ResolutionStrategy;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.exception.InvalidRequestException;
import org.budgetanalyzer.converter.exception.RateUnavailableException;
import org.budgetanalyzer.converter.fixture.TestConstants;
import org.budgetanalyzer.converter.service.cache.RateCacheStore;
import org.budgetanalyzer.converter.service.dto.HistoryRecord;
import org.budgetanalyzer.converter.service.dto.ProviderResponse;
import org.budgetanalyzer.converter.service.dto.Quote;
import org.budgetanalyzer.converter.service.history.RateHistoryStore;

/**
 * Unit tests for {@link RateResolver}.
 *
 * <p>Cache, history and aggregation are mocked; properties, clock and meter registry are real.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RateResolver Unit Tests")
class RateResolverTest {

  private static final CurrencyPair USD_EUR =
      CurrencyPair.of(TestConstants.USD, TestConstants.EUR);
  private static final String AGGREGATED = "aggregated(fixer+frankfurter)";
  private static final Instant PROVIDER_TIME = Instant.parse("2025-01-15T10:29:00Z");

  @Mock private RateCacheStore cacheStore;

  @Mock private RateHistoryStore historyStore;

  @Mock private RateAggregationService aggregationService;

  private CurrencyConverterProperties properties;

  private SimpleMeterRegistry meterRegistry;

  private RateResolver resolver;

  @BeforeEach
  void setUp() {
    properties = new CurrencyConverterProperties();
    meterRegistry = new SimpleMeterRegistry();
    resolver = newResolver();
  }

  private RateResolver newResolver() {
    return new RateResolver(
        cacheStore,
        historyStore,
        aggregationService,
        properties,
        Clock.fixed(TestConstants.NOW, ZoneOffset.UTC),
        meterRegistry);
  }

  private double tierCount(String tier) {
    return meterRegistry.counter(RateResolver.RESOLUTIONS_METRIC, "tier", tier).count();
  }

  // ===========================================================================================
  // resolveRate
  // ===========================================================================================

  @Nested
  @DisplayName("resolveRate")
  class ResolveRate {

    @Test
    @DisplayName("identity pair returns rate 1 without touching any store")
    void identityPairShortCircuits() {
      // When
      var quote = resolver.resolveRate("usd", "USD");

      // Then
      assertThat(quote.rate()).isEqualByComparingTo(BigDecimal.ONE);
      assertThat(quote.source()).isEqualTo("identity");
      assertThat(quote.timestamp()).isEqualTo(TestConstants.NOW);
      assertThat(quote.fromCache()).isFalse();
      verifyNoInteractions(cacheStore, historyStore, aggregationService);
      assertThat(tierCount("identity")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("warm cache returns cached quote with no provider call and no history write")
    void cacheHitReturnsCachedQuote() {
      // Given
      var cached = new Quote(USD_EUR, TestConstants.RATE_USD_EUR, AGGREGATED, PROVIDER_TIME, true);
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.of(cached));

      // When
      var first = resolver.resolveRate("USD", "EUR");
      var second = resolver.resolveRate("usd", "eur");

      // Then
      assertThat(first).isEqualTo(cached);
      assertThat(second).isEqualTo(first);
      verifyNoInteractions(aggregationService, historyStore);
      verify(cacheStore, never()).set(any(), any(), anyString(), any());
      assertThat(tierCount("cache")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("cold cache writes aggregated rate to cache and history exactly once")
    void coldCacheAggregatesAndWritesThrough() {
      // Given
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR))
          .thenReturn(ProviderResponse.success(AGGREGATED, new BigDecimal("1.11"), PROVIDER_TIME));

      // When
      var quote = resolver.resolveRate("USD", "EUR");

      // Then
      assertThat(quote.rate()).isEqualByComparingTo("1.11");
      assertThat(quote.source()).isEqualTo(AGGREGATED);
      assertThat(quote.timestamp()).isEqualTo(PROVIDER_TIME);
      assertThat(quote.fromCache()).isFalse();
      verify(cacheStore, times(1)).set(USD_EUR, new BigDecimal("1.11"), AGGREGATED, PROVIDER_TIME);
      verify(historyStore, times(1)).append(USD_EUR, new BigDecimal("1.11"), AGGREGATED);
      verify(historyStore, never()).latest(any());
      assertThat(tierCount("live")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("fallback strategy asks providers sequentially instead of aggregating")
    void fallbackStrategyUsesSequentialLookup() {
      // Given
      properties.getResolution().setStrategy(ResolutionStrategy.FALLBACK);
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.fetchRateWithFallback(USD_EUR))
          .thenReturn(ProviderResponse.success("currencyapi", new BigDecimal("0.93"), null));

      // When
      var quote = resolver.resolveRate("USD", "EUR");

      // Then
      assertThat(quote.source()).isEqualTo("currencyapi");
      assertThat(quote.timestamp()).isEqualTo(TestConstants.NOW);
      verify(aggregationService, never()).aggregate(any());
      verify(cacheStore).set(USD_EUR, new BigDecimal("0.93"), "currencyapi", TestConstants.NOW);
    }

    @Test
    @DisplayName("all providers failing serves latest history as stale and reseeds the cache")
    void allProvidersFailServesStaleHistory() {
      // Given
      var recordedAt = Instant.parse("2025-01-14T08:00:00Z");
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR)).thenReturn(ProviderResponse.exhausted());
      when(historyStore.latest(USD_EUR))
          .thenReturn(
              Optional.of(
                  new HistoryRecord(7L, USD_EUR, new BigDecimal("0.91"), "fixer", recordedAt)));

      // When
      var quote = resolver.resolveRate("USD", "EUR");

      // Then
      assertThat(quote.rate()).isEqualByComparingTo("0.91");
      assertThat(quote.source()).isEqualTo("fixer (stale)");
      assertThat(quote.timestamp()).isEqualTo(recordedAt);
      assertThat(quote.fromCache()).isFalse();
      verify(historyStore, never()).append(any(), any(), anyString());
      verify(cacheStore).set(USD_EUR, new BigDecimal("0.91"), "fixer (stale)", recordedAt);
      assertThat(tierCount("stale")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("stale fallback leaves the cache alone when reseeding is disabled")
    void staleFallbackWithoutReseed() {
      // Given
      properties.getResolution().setReseedCacheOnStale(false);
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR)).thenReturn(ProviderResponse.exhausted());
      when(historyStore.latest(USD_EUR))
          .thenReturn(
              Optional.of(
                  new HistoryRecord(
                      7L, USD_EUR, new BigDecimal("0.91"), AGGREGATED, TestConstants.NOW)));

      // When
      var quote = resolver.resolveRate("USD", "EUR");

      // Then
      assertThat(quote.source()).isEqualTo(AGGREGATED + " (stale)");
      verify(cacheStore, never()).set(any(), any(), anyString(), any());
    }

    @Test
    @DisplayName("nothing in cache, providers or history raises RateUnavailableException")
    void nothingAvailableThrows() {
      // Given
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR)).thenReturn(ProviderResponse.exhausted());
      when(historyStore.latest(USD_EUR)).thenReturn(Optional.empty());

      // When / Then
      assertThatThrownBy(() -> resolver.resolveRate("USD", "EUR"))
          .isInstanceOfSatisfying(
              RateUnavailableException.class,
              e -> {
                assertThat(e.getPair()).isEqualTo(USD_EUR);
                assertThat(e.getCode()).isEqualTo("RATE_UNAVAILABLE");
                assertThat(e.getMessage())
                    .isEqualTo("Unable to fetch exchange rate for USD → EUR");
              });
      verify(cacheStore, never()).set(any(), any(), anyString(), any());
      verify(historyStore, never()).append(any(), any(), anyString());
      assertThat(tierCount("unavailable")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("blank currency code is rejected before any lookup")
    void blankCodeRejected() {
      assertThatThrownBy(() -> resolver.resolveRate(" ", "EUR"))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(cacheStore, historyStore, aggregationService);
    }
  }

  // ===========================================================================================
  // Request coalescing
  // ===========================================================================================

  @Nested
  @DisplayName("request coalescing")
  class Coalescing {

    @Test
    @DisplayName("concurrent misses for the same pair share one live lookup")
    void concurrentMissesShareOneLookup() throws Exception {
      // Given
      var secondCallerCheckedCache = new CountDownLatch(1);
      var release = new CountDownLatch(1);
      var cacheReads = new AtomicInteger();
      when(cacheStore.get(USD_EUR))
          .thenAnswer(
              invocation -> {
                if (cacheReads.incrementAndGet() == 2) {
                  secondCallerCheckedCache.countDown();
                }
                return Optional.empty();
              });
      when(aggregationService.aggregate(USD_EUR))
          .thenAnswer(
              invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return ProviderResponse.success(AGGREGATED, new BigDecimal("1.11"), PROVIDER_TIME);
              });

      // When
      var first = CompletableFuture.supplyAsync(() -> resolver.resolveRate("USD", "EUR"));
      var second =
          CompletableFuture.supplyAsync(
              () -> {
                // wait until the first caller is blocked inside the lookup
                while (cacheReads.get() < 1) {
                  Thread.onSpinWait();
                }
                sleep(50);
                return resolver.resolveRate("USD", "EUR");
              });
      assertThat(secondCallerCheckedCache.await(5, TimeUnit.SECONDS)).isTrue();
      sleep(100);
      release.countDown();

      // Then
      assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(second.get(5, TimeUnit.SECONDS));
      verify(aggregationService, times(1)).aggregate(USD_EUR);
      verify(historyStore, times(1)).append(any(), any(), anyString());
    }

    @Test
    @DisplayName("in-flight entry is cleared once a lookup completes")
    void sequentialMissesEachResolve() {
      // Given
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR))
          .thenReturn(ProviderResponse.success(AGGREGATED, new BigDecimal("1.11"), PROVIDER_TIME));

      // When
      resolver.resolveRate("USD", "EUR");
      resolver.resolveRate("USD", "EUR");

      // Then
      verify(aggregationService, times(2)).aggregate(USD_EUR);
    }

    @Test
    @DisplayName("a failed lookup does not block later lookups for the pair")
    void failedLookupIsCleared() {
      // Given
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR)).thenReturn(ProviderResponse.exhausted());
      when(historyStore.latest(USD_EUR)).thenReturn(Optional.empty());

      // When / Then
      assertThatThrownBy(() -> resolver.resolveRate("USD", "EUR"))
          .isInstanceOf(RateUnavailableException.class);
      assertThatThrownBy(() -> resolver.resolveRate("USD", "EUR"))
          .isInstanceOf(RateUnavailableException.class);
      verify(aggregationService, times(2)).aggregate(USD_EUR);
    }

    @Test
    @DisplayName("disabled coalescing resolves each miss independently")
    void disabledCoalescing() {
      // Given
      properties.getResolution().setCoalesceConcurrentRequests(false);
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR))
          .thenReturn(ProviderResponse.success(AGGREGATED, new BigDecimal("1.11"), PROVIDER_TIME));

      // When
      var quote = resolver.resolveRate("USD", "EUR");

      // Then
      assertThat(quote.rate()).isEqualByComparingTo("1.11");
      verify(historyStore).append(USD_EUR, new BigDecimal("1.11"), AGGREGATED);
    }
  }

  // ===========================================================================================
  // convert
  // ===========================================================================================

  @Nested
  @DisplayName("convert")
  class Convert {

    @Test
    @DisplayName("applies the resolved rate and rounds half-up to 2 places")
    void convertsAmount() {
      // Given
      when(cacheStore.get(USD_EUR))
          .thenReturn(
              Optional.of(
                  new Quote(USD_EUR, TestConstants.RATE_USD_EUR, AGGREGATED, PROVIDER_TIME, true)));

      // When
      var result = resolver.convert("USD", "EUR", new BigDecimal("100"));

      // Then
      assertThat(result.convertedAmount()).isEqualByComparingTo("92.5");
      assertThat(result.quote().fromCache()).isTrue();
    }

    @Test
    @DisplayName("rejects zero and negative amounts before resolving")
    void rejectsNonPositiveAmount() {
      assertThatThrownBy(() -> resolver.convert("USD", "EUR", BigDecimal.ZERO))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> resolver.convert("USD", "EUR", new BigDecimal("-5")))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(cacheStore, aggregationService, historyStore);
    }

    @Test
    @DisplayName("propagates RateUnavailableException unchanged")
    void propagatesUnavailable() {
      // Given
      when(cacheStore.get(USD_EUR)).thenReturn(Optional.empty());
      when(aggregationService.aggregate(USD_EUR)).thenReturn(ProviderResponse.exhausted());
      when(historyStore.latest(USD_EUR)).thenReturn(Optional.empty());

      // When / Then
      assertThatThrownBy(() -> resolver.convert("USD", "EUR", BigDecimal.TEN))
          .isInstanceOf(RateUnavailableException.class);
    }
  }

  // ===========================================================================================
  // History, pairs and cache administration
  // ===========================================================================================

  @Nested
  @DisplayName("history and administration")
  class HistoryAndAdmin {

    @Test
    @DisplayName("getHistory delegates with the look-back window and labels the period")
    void getHistory() {
      // Given
      var record = new HistoryRecord(1L, USD_EUR, new BigDecimal("0.92"), "fixer", PROVIDER_TIME);
      when(historyStore.rangeByHours(USD_EUR, 24)).thenReturn(List.of(record));

      // When
      var history = resolver.getHistory("usd", "eur", 24);

      // Then
      assertThat(history.pair()).isEqualTo(USD_EUR);
      assertThat(history.period()).isEqualTo("24 hours");
      assertThat(history.count()).isEqualTo(1);
      assertThat(history.records()).containsExactly(record);
    }

    @Test
    @DisplayName("getHistory rejects a look-back window below one hour")
    void getHistoryRejectsZeroHours() {
      assertThatThrownBy(() -> resolver.getHistory("USD", "EUR", 0))
          .isInstanceOf(IllegalArgumentException.class);
      verify(historyStore, never()).rangeByHours(any(), anyInt());
    }

    @Test
    @DisplayName("getHistoryBetween rejects a reversed range")
    void getHistoryBetweenRejectsReversedRange() {
      var start = Instant.parse("2025-01-10T00:00:00Z");
      var end = Instant.parse("2025-01-01T00:00:00Z");

      assertThatThrownBy(() -> resolver.getHistoryBetween("USD", "EUR", start, end))
          .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("getHistoryBetween delegates an inclusive range")
    void getHistoryBetween() {
      // Given
      var start = Instant.parse("2025-01-01T00:00:00Z");
      var end = Instant.parse("2025-01-10T00:00:00Z");
      when(historyStore.rangeByDates(USD_EUR, start, end)).thenReturn(List.of());

      // When
      var history = resolver.getHistoryBetween("USD", "EUR", start, end);

      // Then
      assertThat(history.count()).isZero();
      assertThat(history.period()).isEqualTo(start + " to " + end);
    }

    @Test
    @DisplayName("listPairs returns every recorded pair with its record count")
    void listPairs() {
      // Given
      var usdGbp = CurrencyPair.of("USD", "GBP");
      when(historyStore.distinctPairs()).thenReturn(List.of(USD_EUR, usdGbp));
      when(historyStore.countFor(USD_EUR)).thenReturn(3L);
      when(historyStore.countFor(usdGbp)).thenReturn(1L);

      // When
      var pairs = resolver.listPairs();

      // Then
      assertThat(pairs)
          .extracting(p -> p.pair().toString() + "=" + p.recordCount())
          .containsExactly("USD/EUR=3", "USD/GBP=1");
    }

    @Test
    @DisplayName("cache administration delegates to the cache store")
    void cacheAdministration() {
      // Given
      when(cacheStore.ttlRemaining(USD_EUR)).thenReturn(Optional.of(Duration.ofSeconds(120)));
      when(cacheStore.clearAll()).thenReturn(4L);

      // When
      var ttl = resolver.cacheTtl("usd", "eur");
      resolver.invalidate("usd", "eur");
      var cleared = resolver.invalidateAll();

      // Then
      assertThat(ttl).contains(Duration.ofSeconds(120));
      assertThat(cleared).isEqualTo(4L);
      verify(cacheStore).delete(USD_EUR);
    }

    @Test
    @DisplayName("purgeHistory delegates and rejects a retention below one day")
    void purgeHistory() {
      // Given
      when(historyStore.purgeOlderThan(30)).thenReturn(12);

      // When / Then
      assertThat(resolver.purgeHistory(30)).isEqualTo(12);
      assertThatThrownBy(() -> resolver.purgeHistory(0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
