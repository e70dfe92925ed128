package org.budgetanalyzer.converter.service.history;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.domain.ExchangeRateRecord;
import org.budgetanalyzer.converter.repository.ExchangeRateRecordRepository;
import org.budgetanalyzer.converter.service.dto.HistoryRecord;

/** JPA-backed {@link RateHistoryStore} over the {@code exchange_rate_history} table. */
@Component
@Transactional(readOnly = true)
public class JpaRateHistoryStore implements RateHistoryStore {

  private static final Logger log = LoggerFactory.getLogger(JpaRateHistoryStore.class);

  private final ExchangeRateRecordRepository repository;
  private final Clock clock;

  public JpaRateHistoryStore(ExchangeRateRecordRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public HistoryRecord append(CurrencyPair pair, BigDecimal rate, String source) {
    var entity = new ExchangeRateRecord();
    entity.setBaseCurrency(pair.base());
    entity.setTargetCurrency(pair.target());
    entity.setRate(rate);
    entity.setSource(source);
    entity.setCreatedAt(Instant.now(clock));

    var saved = repository.save(entity);
    log.debug("Recorded {} = {} from {} (id: {})", pair, rate, source, saved.getId());
    return HistoryRecord.from(saved);
  }

  @Override
  public Optional<HistoryRecord> latest(CurrencyPair pair) {
    return repository
        .findTopByBaseCurrencyAndTargetCurrencyOrderByCreatedAtDescIdDesc(
            pair.base(), pair.target())
        .map(HistoryRecord::from);
  }

  @Override
  public List<HistoryRecord> rangeByHours(CurrencyPair pair, int hoursBack) {
    var since = Instant.now(clock).minus(Duration.ofHours(hoursBack));
    return repository
        .findByBaseCurrencyAndTargetCurrencyAndCreatedAtAfterOrderByCreatedAtDesc(
            pair.base(), pair.target(), since)
        .stream()
        .map(HistoryRecord::from)
        .toList();
  }

  @Override
  public List<HistoryRecord> rangeByDates(CurrencyPair pair, Instant start, Instant end) {
    return repository
        .findByBaseCurrencyAndTargetCurrencyAndCreatedAtBetweenOrderByCreatedAtDesc(
            pair.base(), pair.target(), start, end)
        .stream()
        .map(HistoryRecord::from)
        .toList();
  }

  @Override
  public long countFor(CurrencyPair pair) {
    return repository.countByBaseCurrencyAndTargetCurrency(pair.base(), pair.target());
  }

  @Override
  public List<CurrencyPair> distinctPairs() {
    return repository.findDistinctPairs();
  }

  @Override
  @Transactional
  public int purgeOlderThan(int daysToKeep) {
    var cutoff = Instant.now(clock).minus(Duration.ofDays(daysToKeep));
    var deleted = repository.deleteByCreatedAtBefore(cutoff);
    log.info("Purged {} history records created before {}", deleted, cutoff);
    return deleted;
  }
}
