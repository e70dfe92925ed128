package org.budgetanalyzer.converter.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.service.RateResolver;

/**
 * Periodically deletes history records older than the configured retention window.
 *
 * <p>Runs on one instance at a time (ShedLock). A failed run is logged and counted, the next run
 * picks up whatever was left.
 */
@Component
public class HistoryRetentionScheduler {

  private static final Logger log = LoggerFactory.getLogger(HistoryRetentionScheduler.class);

  private final MeterRegistry meterRegistry;
  private final CurrencyConverterProperties properties;
  private final RateResolver rateResolver;

  public HistoryRetentionScheduler(
      MeterRegistry meterRegistry,
      CurrencyConverterProperties properties,
      RateResolver rateResolver) {
    this.meterRegistry = meterRegistry;
    this.properties = properties;
    this.rateResolver = rateResolver;
  }

  @Scheduled(cron = "${currency-converter.history.retention.cron:0 0 3 * * ?}", zone = "UTC")
  @SchedulerLock(name = "historyRetention", lockAtMostFor = "10m", lockAtLeastFor = "1m")
  public void purgeExpiredHistory() {
    var retention = properties.getHistory().getRetention();
    if (!retention.isEnabled()) {
      log.debug("History retention purge is disabled");
      return;
    }

    log.info("Starting history retention purge (days to keep: {})", retention.getDaysToKeep());
    var sample = Timer.start(meterRegistry);

    try {
      var purged = rateResolver.purgeHistory(retention.getDaysToKeep());
      log.info("History retention purge removed {} records", purged);
      recordSuccess(sample, purged);
    } catch (Exception e) {
      log.error("History retention purge failed: {}", e.getMessage(), e);
      recordFailure(sample, e);
    }
  }

  private void recordSuccess(Timer.Sample sample, int purged) {
    sample.stop(
        Timer.builder("exchange.rate.history.purge.duration")
            .tag("status", "success")
            .register(meterRegistry));

    meterRegistry
        .counter("exchange.rate.history.purge.executions", "status", "success")
        .increment();
    meterRegistry.counter("exchange.rate.history.purged").increment(purged);
  }

  private void recordFailure(Timer.Sample sample, Exception e) {
    sample.stop(
        Timer.builder("exchange.rate.history.purge.duration")
            .tag("status", "failure")
            .tag("error", e.getClass().getSimpleName())
            .register(meterRegistry));

    meterRegistry
        .counter(
            "exchange.rate.history.purge.executions",
            "status",
            "failure",
            "error",
            e.getClass().getSimpleName())
        .increment();
  }
}
