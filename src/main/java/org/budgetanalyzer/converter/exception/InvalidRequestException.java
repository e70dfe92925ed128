package org.budgetanalyzer.converter.exception;

/** Request is well-formed but its parameters are inconsistent, e.g. a reversed date range. */
public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
