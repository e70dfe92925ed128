package org.budgetanalyzer.converter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.converter.service.RateAggregationService;

/** Logs the effective configuration once the application is ready. API keys are masked. */
@Component
public class CurrencyConverterStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(CurrencyConverterStartupConfig.class);

  private static final int VISIBLE_KEY_CHARS = 4;

  private final CurrencyConverterProperties properties;
  private final RateAggregationService rateAggregationService;

  public CurrencyConverterStartupConfig(
      CurrencyConverterProperties properties, RateAggregationService rateAggregationService) {
    this.properties = properties;
    this.rateAggregationService = rateAggregationService;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    log.info("Currency Converter Configuration:\n{}", describeConfiguration());

    var enabledProviders = rateAggregationService.getProviderNames();
    if (enabledProviders.isEmpty()) {
      log.warn("No rate providers are enabled, only cached and recorded rates can be served");
    } else {
      log.info("Enabled rate providers: {}", enabledProviders);
    }
  }

  String describeConfiguration() {
    var cache = properties.getCache();
    var resolution = properties.getResolution();
    var providers = properties.getProviders();
    var retention = properties.getHistory().getRetention();

    return new StringBuilder()
        .append("  cache: ttlSeconds=")
        .append(cache.getTtlSeconds())
        .append(", keyPrefix=")
        .append(cache.getKeyPrefix())
        .append('\n')
        .append("  resolution: strategy=")
        .append(resolution.getStrategy())
        .append(", reseedCacheOnStale=")
        .append(resolution.isReseedCacheOnStale())
        .append(", coalesceConcurrentRequests=")
        .append(resolution.isCoalesceConcurrentRequests())
        .append('\n')
        .append("  providers: executorPoolSize=")
        .append(providers.getExecutorPoolSize())
        .append('\n')
        .append(describeProvider("fixer", providers.getFixer()))
        .append(describeProvider("frankfurter", providers.getFrankfurter()))
        .append(describeProvider("currencyApi", providers.getCurrencyApi()))
        .append("  history.retention: enabled=")
        .append(retention.isEnabled())
        .append(", daysToKeep=")
        .append(retention.getDaysToKeep())
        .append(", cron=")
        .append(retention.getCron())
        .toString();
  }

  private static String describeProvider(String name, CurrencyConverterProperties.Provider p) {
    return "    "
        + name
        + ": enabled="
        + p.isEnabled()
        + ", baseUrl="
        + p.getBaseUrl()
        + ", apiKey="
        + maskApiKey(p.getApiKey())
        + ", timeoutSeconds="
        + p.getTimeoutSeconds()
        + '\n';
  }

  static String maskApiKey(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      return "<not set>";
    }
    if (apiKey.length() <= VISIBLE_KEY_CHARS) {
      return "****";
    }

    return "****" + apiKey.substring(apiKey.length() - VISIBLE_KEY_CHARS);
  }
}
