package org.retention.churn.exception;

/**
 * Thrown when a write collides with stored state: a duplicate id, an integrity violation or a
 * concurrent update of the same customer.
 * Maps to HTTP 409 - Conflict.
 */
public class CustomerConflictException extends RuntimeException {

  public CustomerConflictException(String message) {
    super(message);
  }

  public CustomerConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
