package org.budgetanalyzer.converter.service.cache;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.dto.CachedRate;
import org.budgetanalyzer.converter.service.dto.Quote;

/**
 * Redis-backed {@link RateCacheStore}. Keys are {@code {prefix}{BASE}:{TARGET}} and values are
 * JSON {@link CachedRate} documents written with the configured TTL.
 *
 * <p>Redis errors are not caught here; a cache outage fails the request. {@link #clearAll()}
 * collects keys with {@code SCAN}.
 */
@Component
public class RedisRateCacheStore implements RateCacheStore {

  private static final Logger log = LoggerFactory.getLogger(RedisRateCacheStore.class);

  private static final long SCAN_BATCH_SIZE = 500;

  private final RedisTemplate<String, CachedRate> redisTemplate;
  private final String keyPrefix;
  private final Duration ttl;

  public RedisRateCacheStore(
      RedisTemplate<String, CachedRate> rateRedisTemplate, CurrencyConverterProperties properties) {
    this.redisTemplate = rateRedisTemplate;
    this.keyPrefix = properties.getCache().getKeyPrefix();
    this.ttl = Duration.ofSeconds(properties.getCache().getTtlSeconds());
  }

  @Override
  public Optional<Quote> get(CurrencyPair pair) {
    var cached = redisTemplate.opsForValue().get(keyFor(pair));
    if (cached == null) {
      return Optional.empty();
    }

    return Optional.of(new Quote(pair, cached.rate(), cached.source(), cached.timestamp(), true));
  }

  @Override
  public void set(CurrencyPair pair, BigDecimal rate, String source, Instant timestamp) {
    var value = new CachedRate(pair.base(), pair.target(), rate, source, timestamp);
    redisTemplate.opsForValue().set(keyFor(pair), value, ttl);
    log.debug("Cached {} = {} ({}) for {}s", pair, rate, source, ttl.toSeconds());
  }

  @Override
  public Optional<Duration> ttlRemaining(CurrencyPair pair) {
    var seconds = redisTemplate.getExpire(keyFor(pair), TimeUnit.SECONDS);

    // -2: no key, -1: key without expiry
    if (seconds == null || seconds < 0) {
      return Optional.empty();
    }

    return Optional.of(Duration.ofSeconds(seconds));
  }

  @Override
  public void delete(CurrencyPair pair) {
    var deleted = Boolean.TRUE.equals(redisTemplate.delete(keyFor(pair)));
    log.info("Invalidated cached rate for {} (present: {})", pair, deleted);
  }

  @Override
  public long clearAll() {
    var keys = scanKeys(keyPrefix + "*");
    if (keys.isEmpty()) {
      log.info("No cached rates to clear");
      return 0;
    }

    var deleted = redisTemplate.delete(keys);
    var count = deleted == null ? 0 : deleted;
    log.info("Cleared {} cached rates", count);
    return count;
  }

  private List<String> scanKeys(String pattern) {
    var options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();
    var keys = new ArrayList<String>();
    try (var cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        keys.add(cursor.next());
      }
    }
    return keys;
  }

  String keyFor(CurrencyPair pair) {
    return keyPrefix + pair.base() + ":" + pair.target();
  }
}
