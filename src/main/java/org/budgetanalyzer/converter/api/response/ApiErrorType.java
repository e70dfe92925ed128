package org.budgetanalyzer.converter.api.response;

public enum ApiErrorType {
  INVALID_REQUEST,
  NOT_FOUND,
  SERVICE_UNAVAILABLE,
  INTERNAL_ERROR
}
