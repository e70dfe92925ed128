package org.budgetanalyzer.converter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "currency-converter")
@Validated
public class CurrencyConverterProperties {

  @Valid private Cache cache = new Cache();
  @Valid private Resolution resolution = new Resolution();
  @Valid private Providers providers = new Providers();
  @Valid private History history = new History();

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Resolution getResolution() {
    return resolution;
  }

  public void setResolution(Resolution resolution) {
    this.resolution = resolution;
  }

  public Providers getProviders() {
    return providers;
  }

  public void setProviders(Providers providers) {
    this.providers = providers;
  }

  public History getHistory() {
    return history;
  }

  public void setHistory(History history) {
    this.history = history;
  }

  public static class Cache {

    /** Time-to-live applied to every cached rate. */
    @Min(1)
    @Max(86400)
    private long ttlSeconds = 300;

    /** Prefix of every rate cache key; keys look like {@code rate:USD:EUR}. */
    @NotBlank private String keyPrefix = "rate:";

    public long getTtlSeconds() {
      return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
      this.ttlSeconds = ttlSeconds;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }

  public static class Resolution {

    /** How live rates are fetched on a cache miss. */
    @NotNull private ResolutionStrategy strategy = ResolutionStrategy.AGGREGATE;

    /** Write a stale history rate back to the cache so an outage doesn't hit every provider. */
    private boolean reseedCacheOnStale = true;

    /** Let concurrent requests for the same cold pair share a single live resolution. */
    private boolean coalesceConcurrentRequests = true;

    public ResolutionStrategy getStrategy() {
      return strategy;
    }

    public void setStrategy(ResolutionStrategy strategy) {
      this.strategy = strategy;
    }

    public boolean isReseedCacheOnStale() {
      return reseedCacheOnStale;
    }

    public void setReseedCacheOnStale(boolean reseedCacheOnStale) {
      this.reseedCacheOnStale = reseedCacheOnStale;
    }

    public boolean isCoalesceConcurrentRequests() {
      return coalesceConcurrentRequests;
    }

    public void setCoalesceConcurrentRequests(boolean coalesceConcurrentRequests) {
      this.coalesceConcurrentRequests = coalesceConcurrentRequests;
    }
  }

  public enum ResolutionStrategy {
    /** Ask every provider in parallel and average the successful rates. */
    AGGREGATE,

    /** Ask providers one at a time in priority order; the first success wins. */
    FALLBACK
  }

  public static class Providers {

    /** Threads available for concurrent provider calls. */
    @Min(1)
    @Max(64)
    private int executorPoolSize = 6;

    @Valid private Provider fixer = new Provider("https://api.fixer.io");
    @Valid private Provider frankfurter = new Provider("https://api.frankfurter.app");
    @Valid private Provider currencyApi = new Provider("https://api.currencyapi.com");

    public int getExecutorPoolSize() {
      return executorPoolSize;
    }

    public void setExecutorPoolSize(int executorPoolSize) {
      this.executorPoolSize = executorPoolSize;
    }

    public Provider getFixer() {
      return fixer;
    }

    public void setFixer(Provider fixer) {
      this.fixer = fixer;
    }

    public Provider getFrankfurter() {
      return frankfurter;
    }

    public void setFrankfurter(Provider frankfurter) {
      this.frankfurter = frankfurter;
    }

    public Provider getCurrencyApi() {
      return currencyApi;
    }

    public void setCurrencyApi(Provider currencyApi) {
      this.currencyApi = currencyApi;
    }
  }

  public static class Provider {

    private boolean enabled = true;

    @NotBlank private String baseUrl;

    /** API key - should be set via environment variable. Never logged in clear. */
    private String apiKey;

    /** Timeout in seconds for a single rate request. */
    @Min(1)
    @Max(60)
    private int timeoutSeconds = 5;

    public Provider() {}

    public Provider(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public boolean hasApiKey() {
      return apiKey != null && !apiKey.isBlank();
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }

  public static class History {

    @Valid private Retention retention = new Retention();

    public Retention getRetention() {
      return retention;
    }

    public void setRetention(Retention retention) {
      this.retention = retention;
    }
  }

  public static class Retention {

    /** Whether the scheduled purge of old history rows runs. */
    private boolean enabled = true;

    /** Rows older than this many days are purged. */
    @Min(1)
    @Max(3650)
    private int daysToKeep = 30;

    /** Cron expression for the purge job (UTC). */
    @NotBlank private String cron = "0 0 3 * * ?";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getDaysToKeep() {
      return daysToKeep;
    }

    public void setDaysToKeep(int daysToKeep) {
      this.daysToKeep = daysToKeep;
    }

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }
  }
}
