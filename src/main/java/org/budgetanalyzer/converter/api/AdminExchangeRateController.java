package org.budgetanalyzer.converter.api;

import static org.budgetanalyzer.converter.api.ExchangeRateController.CURRENCY_CODE_MESSAGE;
import static org.budgetanalyzer.converter.api.ExchangeRateController.CURRENCY_CODE_PATTERN;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.converter.api.response.CacheTtlResponse;
import org.budgetanalyzer.converter.api.response.PurgeResultResponse;
import org.budgetanalyzer.converter.domain.CurrencyPair;
import org.budgetanalyzer.converter.service.RateResolver;

/** Admin endpoints for rate cache and history maintenance. */
@Tag(
    name = "Admin - Exchange Rates Handler",
    description = "Admin endpoints for managing the rate cache and recorded history")
@RestController
@RequestMapping(path = "/v1/admin/exchange-rates")
public class AdminExchangeRateController {

  private static final Logger log = LoggerFactory.getLogger(AdminExchangeRateController.class);

  private final RateResolver rateResolver;

  public AdminExchangeRateController(RateResolver rateResolver) {
    this.rateResolver = rateResolver;
  }

  @Operation(
      summary = "Invalidate cached rate",
      description = "Remove the cached rate for a pair so the next request fetches it live")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Cached rate removed (or not present)"),
        @ApiResponse(responseCode = "400", description = "Invalid request")
      })
  @DeleteMapping(path = "/cache")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void invalidateCache(
      @Parameter(description = "Base currency", example = "USD")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String to) {
    log.info("Received invalidateCache request - from: {}, to: {}", from, to);

    rateResolver.invalidate(from, to);
  }

  @Operation(summary = "Clear rate cache", description = "Remove every cached rate")
  @ApiResponses(value = {@ApiResponse(responseCode = "204", description = "Cache cleared")})
  @DeleteMapping(path = "/cache/all")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void clearCache() {
    log.info("Received clearCache request");

    var cleared = rateResolver.invalidateAll();
    log.info("Cleared {} cached rates", cleared);
  }

  @Operation(
      summary = "Get cache TTL",
      description = "Remaining lifetime of the cached rate for a pair")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CacheTtlResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request")
      })
  @GetMapping(path = "/cache/ttl", produces = "application/json")
  public CacheTtlResponse getCacheTtl(
      @Parameter(description = "Base currency", example = "USD")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String to) {
    log.info("Received getCacheTtl request - from: {}, to: {}", from, to);

    var pair = CurrencyPair.of(from, to);
    var ttl = rateResolver.cacheTtl(pair.base(), pair.target());
    return new CacheTtlResponse(
        pair.base(), pair.target(), ttl.isPresent(), ttl.map(d -> d.toSeconds()).orElse(null));
  }

  @Operation(
      summary = "Purge rate history",
      description =
          "Delete recorded rates older than the given number of days - manually triggers the"
              + " retention job")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = PurgeResultResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request")
      })
  @PostMapping(path = "/history/purge", produces = "application/json")
  public PurgeResultResponse purgeHistory(
      @Parameter(description = "Records older than this many days are deleted", example = "30")
          @RequestParam(defaultValue = "30")
          @Min(1)
          @Max(3650)
          int daysToKeep) {
    log.info("Received purgeHistory request - daysToKeep: {}", daysToKeep);

    var deleted = rateResolver.purgeHistory(daysToKeep);
    return new PurgeResultResponse(daysToKeep, deleted);
  }
}
