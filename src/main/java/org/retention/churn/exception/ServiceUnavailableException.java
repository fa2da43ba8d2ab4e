package org.retention.churn.exception;

/**
 * Thrown when the database or the event broker is temporarily unreachable.
 * Maps to HTTP 503 - Service Unavailable.
 */
public class ServiceUnavailableException extends RuntimeException {

  public ServiceUnavailableException(String message) {
    super(message);
  }

  public ServiceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
