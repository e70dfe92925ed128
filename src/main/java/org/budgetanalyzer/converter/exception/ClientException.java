package org.budgetanalyzer.converter.exception;

/**
 * Raised by outbound HTTP clients when an external API call fails (network error, timeout,
 * non-success status or unusable payload).
 */
public class ClientException extends ServiceException {

  public ClientException(String message) {
    super(message);
  }

  public ClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
