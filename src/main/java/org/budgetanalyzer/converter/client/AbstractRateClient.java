package org.budgetanalyzer.converter.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.converter.config.CurrencyConverterProperties;
import org.budgetanalyzer.converter.exception.ClientException;

/**
 * Base class for the blocking rate API clients.
 *
 * <p>Every request is bounded by the provider's configured timeout. Any failure (non-2xx status,
 * timeout, connection error, unreadable body) surfaces as a {@link ClientException}. Messages
 * never include the request URL because it carries the API key as a query parameter.
 */
public abstract class AbstractRateClient {

  private static final Logger log = LoggerFactory.getLogger(AbstractRateClient.class);

  private static final String USER_AGENT = "CurrencyConverterClient/1.0";
  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final Duration timeout;
  private final String apiName;

  protected AbstractRateClient(
      String apiName,
      WebClient.Builder webClientBuilder,
      CurrencyConverterProperties.Provider providerConfig) {
    this.apiName = apiName;
    this.timeout = Duration.ofSeconds(providerConfig.getTimeoutSeconds());
    // builder bean is shared, so each client configures its own copy
    this.webClient =
        webClientBuilder
            .clone()
            .baseUrl(providerConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();

    log.info(
        "{} client initialized with base URL: {}, timeout: {}s",
        apiName,
        providerConfig.getBaseUrl(),
        providerConfig.getTimeoutSeconds());
  }

  protected <T> T get(String uri, Class<T> responseType) {
    try {
      var response =
          webClient
              .get()
              .uri(uri)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(responseType)
              .timeout(timeout)
              .block();

      if (response == null) {
        throw new ClientException("Received empty response from " + apiName + " API");
      }

      return response;
    } catch (ClientException ce) {
      throw ce;
    } catch (Exception e) {
      throw new ClientException(
          "Failed to call " + apiName + " API: " + e.getClass().getSimpleName(), e);
    }
  }

  protected static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> createException(response.statusCode(), body));
  }

  private Throwable createException(HttpStatusCode statusCode, String body) {
    var errorMessage = body;
    if (body.length() > MAX_ERROR_BODY_LENGTH) {
      errorMessage = body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
    }

    return new ClientException(
        apiName + " API error: HTTP " + statusCode.value() + " - " + errorMessage);
  }
}
