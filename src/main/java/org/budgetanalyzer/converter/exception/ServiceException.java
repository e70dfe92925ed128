package org.budgetanalyzer.converter.exception;

/** Base class for all unchecked exceptions raised by the currency converter service. */
public class ServiceException extends RuntimeException {

  public ServiceException(String message) {
    super(message);
  }

  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
