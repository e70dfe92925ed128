package org.budgetanalyzer.converter.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.budgetanalyzer.converter.base.AbstractRepositoryTest;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.fixture.ExchangeRateRecordTestBuilder;
import org.budgetanalyzer.converter.fixture.TestConstants;

/**
 * Tests for {@link ExchangeRateRecordRepository} using {@code @DataJpaTest} with H2.
 *
 * <p>Covers the derived queries used by the history store, the distinct pair projection and the
 * bulk delete used by retention.
 */
class ExchangeRateRecordRepositoryTest extends AbstractRepositoryTest {

  private static final Instant NOW = TestConstants.NOW;

  @Autowired private ExchangeRateRecordRepository repository;

  // ===========================================================================================
  // findTopBy...OrderByCreatedAtDescIdDesc
  // ===========================================================================================

  @Test
  void findLatestReturnsMostRecentRecord() {
    // Arrange
    save("0.90", NOW.minusSeconds(7200));
    save("0.92", NOW);
    save("0.91", NOW.minusSeconds(3600));

    // Act
    var latest =
        repository.findTopByBaseCurrencyAndTargetCurrencyOrderByCreatedAtDescIdDesc("USD", "EUR");

    // Assert
    assertThat(latest).isPresent();
    assertThat(latest.get().getRate()).isEqualByComparingTo("0.92");
  }

  @Test
  void findLatestBreaksTimestampTiesByInsertOrder() {
    // Arrange
    repository.save(ExchangeRateRecordTestBuilder.usdEur().rate("0.90").source("first").build());
    repository.save(ExchangeRateRecordTestBuilder.usdEur().rate("0.91").source("second").build());

    // Act
    var latest =
        repository.findTopByBaseCurrencyAndTargetCurrencyOrderByCreatedAtDescIdDesc("USD", "EUR");

    // Assert
    assertThat(latest).get().extracting(r -> r.getSource()).isEqualTo("second");
  }

  @Test
  void findLatestIsEmptyForUnknownPair() {
    // Arrange
    repository.save(ExchangeRateRecordTestBuilder.usdEur().build());

    // Act / Assert
    assertThat(
            repository.findTopByBaseCurrencyAndTargetCurrencyOrderByCreatedAtDescIdDesc(
                "EUR", "USD"))
        .isEmpty();
  }

  // ===========================================================================================
  // Range queries
  // ===========================================================================================

  @Test
  void findCreatedAfterReturnsNewestFirstForPairOnly() {
    // Arrange
    save("0.91", NOW.minus(Duration.ofHours(2)));
    save("0.92", NOW.minus(Duration.ofHours(1)));
    save("0.80", NOW.minus(Duration.ofDays(2)));
    repository.save(
        ExchangeRateRecordTestBuilder.usdEur().pair("USD", "GBP").rate("0.79").build());

    // Act
    var records =
        repository.findByBaseCurrencyAndTargetCurrencyAndCreatedAtAfterOrderByCreatedAtDesc(
            "USD", "EUR", NOW.minus(Duration.ofHours(24)));

    // Assert
    assertThat(records).hasSize(2);
    assertThat(records.get(0).getRate()).isEqualByComparingTo("0.92");
    assertThat(records.get(1).getRate()).isEqualByComparingTo("0.91");
  }

  @Test
  void findBetweenIsInclusiveOfBothEnds() {
    // Arrange
    var start = Instant.parse("2025-01-01T00:00:00Z");
    var end = Instant.parse("2025-01-10T00:00:00Z");
    save("0.90", start);
    save("0.91", end);
    save("0.95", end.plusSeconds(1));

    // Act
    var records =
        repository.findByBaseCurrencyAndTargetCurrencyAndCreatedAtBetweenOrderByCreatedAtDesc(
            "USD", "EUR", start, end);

    // Assert
    assertThat(records).hasSize(2);
    assertThat(records.get(0).getCreatedAt()).isEqualTo(end);
    assertThat(records.get(1).getCreatedAt()).isEqualTo(start);
  }

  // ===========================================================================================
  // Pairs and counts
  // ===========================================================================================

  @Test
  void findDistinctPairsOrdersByBaseThenTarget() {
    // Arrange
    repository.save(ExchangeRateRecordTestBuilder.usdEur().pair("USD", "GBP").build());
    repository.save(ExchangeRateRecordTestBuilder.usdEur().pair("EUR", "USD").build());
    repository.save(ExchangeRateRecordTestBuilder.usdEur().build());
    repository.save(ExchangeRateRecordTestBuilder.usdEur().build());

    // Act
    var pairs = repository.findDistinctPairs();

    // Assert
    assertThat(pairs)
        .containsExactly(
            CurrencyPair.of("EUR", "USD"),
            CurrencyPair.of("USD", "EUR"),
            CurrencyPair.of("USD", "GBP"));
    assertThat(repository.countByBaseCurrencyAndTargetCurrency("USD", "EUR")).isEqualTo(2);
    assertThat(repository.countByBaseCurrencyAndTargetCurrency("JPY", "EUR")).isZero();
  }

  // ===========================================================================================
  // Retention delete
  // ===========================================================================================

  @Test
  void deleteByCreatedAtBeforeRemovesOnlyOlderRecords() {
    // Arrange
    var cutoff = NOW.minus(Duration.ofDays(30));
    save("0.90", cutoff.minusSeconds(1));
    save("0.90", cutoff.minus(Duration.ofDays(5)));
    save("0.91", cutoff);
    save("0.92", NOW);

    // Act
    var deleted = repository.deleteByCreatedAtBefore(cutoff);

    // Assert
    assertThat(deleted).isEqualTo(2);
    assertThat(repository.findAll())
        .extracting(r -> r.getCreatedAt())
        .containsExactlyInAnyOrder(cutoff, NOW);
  }

  private void save(String rate, Instant createdAt) {
    repository.save(ExchangeRateRecordTestBuilder.usdEur().rate(rate).createdAt(createdAt).build());
  }
}
