package org.budgetanalyzer.converter.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Error body returned for every failed request.
 *
 * @param type broad error category
 * @param message human readable description
 * @param code machine readable error code, omitted when there is none
 */
@Schema(description = "Error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(description = "Error category", example = "SERVICE_UNAVAILABLE") ApiErrorType type,
    @Schema(
            description = "Error message",
            example = "Unable to fetch exchange rate for USD → EUR")
        String message,
    @Schema(description = "Error code", example = "RATE_UNAVAILABLE") String code) {

  public static ApiErrorResponse of(ApiErrorType type, String message) {
    return new ApiErrorResponse(type, message, null);
  }
}
