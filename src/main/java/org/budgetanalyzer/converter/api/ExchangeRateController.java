package org.budgetanalyzer.converter.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.converter.api.response.ApiErrorResponse;
import org.budgetanalyzer.converter.api.response.ConversionResponse;
import org.budgetanalyzer.converter.api.response.CurrencyPairResponse;
import org.budgetanalyzer.converter.api.response.ExchangeRateResponse;
import org.budgetanalyzer.converter.api.response.RateHistoryResponse;
import org.budgetanalyzer.converter.service.RateResolver;

@Tag(
    name = "Exchange Rates Handler",
    description = "Endpoints for resolving exchange rates and converting amounts")
@RestController
@RequestMapping(path = "/v1/exchange-rates")
public class ExchangeRateController {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateController.class);

  static final String CURRENCY_CODE_PATTERN = "^[A-Za-z]{3}$";
  static final String CURRENCY_CODE_MESSAGE = "must be a 3-letter currency code";

  private final RateResolver rateResolver;

  public ExchangeRateController(RateResolver rateResolver) {
    this.rateResolver = rateResolver;
  }

  @Operation(
      summary = "Get exchange rate",
      description =
          "Get the current rate for a currency pair. Served from cache when available, otherwise"
              + " fetched live from the rate providers, falling back to the last recorded rate")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ExchangeRateResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "503",
            description = "No rate could be resolved",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Rate Unavailable",
                          summary = "All providers failed and no rate was ever recorded",
                          value =
                              """
                      {
                        "type": "SERVICE_UNAVAILABLE",
                        "message": "Unable to fetch exchange rate for USD → XYZ",
                        "code": "RATE_UNAVAILABLE"
                      }
                      """)
                    }))
      })
  @GetMapping(path = "", produces = "application/json")
  public ExchangeRateResponse getExchangeRate(
      @Parameter(description = "Base currency", example = "USD")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String to) {
    log.info("Received getExchangeRate request - from: {}, to: {}", from, to);

    return ExchangeRateResponse.from(rateResolver.resolveRate(from, to));
  }

  @Operation(
      summary = "Convert amount",
      description = "Convert an amount at the current rate, rounded half-up to 2 decimal places")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ConversionResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "503",
            description = "No rate could be resolved",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/convert", produces = "application/json")
  public ConversionResponse convert(
      @Parameter(description = "Base currency", example = "USD")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String to,
      @Parameter(description = "Amount in base currency", example = "100")
          @RequestParam
          @DecimalMin(value = "0", inclusive = false)
          @DecimalMax(value = "1000000000")
          BigDecimal amount) {
    log.info("Received convert request - from: {}, to: {}, amount: {}", from, to, amount);

    return ConversionResponse.from(rateResolver.convert(from, to, amount));
  }

  @Operation(
      summary = "Get recent rate history",
      description = "Rates recorded for a pair within the last N hours, newest first")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RateHistoryResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request")
      })
  @GetMapping(path = "/history", produces = "application/json")
  public RateHistoryResponse getHistory(
      @Parameter(description = "Base currency", example = "USD")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String to,
      @Parameter(description = "Look-back window in hours", example = "24")
          @RequestParam(defaultValue = "24")
          @Min(1)
          @Max(720)
          int hours) {
    log.info("Received getHistory request - from: {}, to: {}, hours: {}", from, to, hours);

    return RateHistoryResponse.from(rateResolver.getHistory(from, to, hours));
  }

  @Operation(
      summary = "Get rate history for a time range",
      description = "Rates recorded for a pair between two instants (inclusive), newest first")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RateHistoryResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request")
      })
  @GetMapping(path = "/history/range", produces = "application/json")
  public RateHistoryResponse getHistoryRange(
      @Parameter(description = "Base currency", example = "USD")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String from,
      @Parameter(description = "Target currency", example = "EUR")
          @RequestParam
          @Pattern(regexp = CURRENCY_CODE_PATTERN, message = CURRENCY_CODE_MESSAGE)
          String to,
      @Parameter(description = "Range start (ISO-8601 instant)", example = "2025-01-01T00:00:00Z")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant start,
      @Parameter(description = "Range end (ISO-8601 instant)", example = "2025-01-31T23:59:59Z")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant end) {
    log.info(
        "Received getHistoryRange request - from: {}, to: {}, start: {}, end: {}",
        from,
        to,
        start,
        end);

    return RateHistoryResponse.from(rateResolver.getHistoryBetween(from, to, start, end));
  }

  @Operation(
      summary = "List currency pairs",
      description = "Every currency pair with recorded history and its number of records")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema = @Schema(implementation = CurrencyPairResponse.class))))
      })
  @GetMapping(path = "/pairs", produces = "application/json")
  public List<CurrencyPairResponse> listPairs() {
    log.info("Received listPairs request");

    return rateResolver.listPairs().stream().map(CurrencyPairResponse::from).toList();
  }
}
