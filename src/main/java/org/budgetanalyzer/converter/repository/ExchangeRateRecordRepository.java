package org.budgetanalyzer.converter.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.domain.ExchangeRateRecord;

/** Repository for the append-only exchange rate history. */
public interface ExchangeRateRecordRepository extends JpaRepository<ExchangeRateRecord, Long> {

  /**
   * Finds the most recently recorded rate for a pair. Rows sharing a timestamp are ordered by id
   * so the last insert wins.
   *
   * @param baseCurrency upper-case base currency code
   * @param targetCurrency upper-case target currency code
   * @return Optional containing the newest record, or empty if the pair was never recorded
   */
  Optional<ExchangeRateRecord>
      findTopByBaseCurrencyAndTargetCurrencyOrderByCreatedAtDescIdDesc(
          String baseCurrency, String targetCurrency);

  List<ExchangeRateRecord> findByBaseCurrencyAndTargetCurrencyAndCreatedAtAfterOrderByCreatedAtDesc(
      String baseCurrency, String targetCurrency, Instant createdAfter);

  List<ExchangeRateRecord>
      findByBaseCurrencyAndTargetCurrencyAndCreatedAtBetweenOrderByCreatedAtDesc(
          String baseCurrency, String targetCurrency, Instant start, Instant end);

  long countByBaseCurrencyAndTargetCurrency(String baseCurrency, String targetCurrency);

  /**
   * Lists every pair that has at least one recorded rate.
   *
   * @return distinct pairs ordered by base then target currency
   */
  @Query(
      "SELECT DISTINCT new org.budgetanalyzer.converter.domain.CurrencyPair("
          + "e.baseCurrency, e.targetCurrency) FROM ExchangeRateRecord e "
          + "ORDER BY e.baseCurrency, e.targetCurrency")
  List<CurrencyPair> findDistinctPairs();

  /**
   * Deletes every record created before the cutoff.
   *
   * @param cutoff records strictly older than this instant are removed
   * @return the number of deleted rows
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM ExchangeRateRecord e WHERE e.createdAt < :cutoff")
  int deleteByCreatedAtBefore(@Param("cutoff") Instant cutoff);
}
