package org.retention.churn.exception;

import org.retention.churn.domain.TransitionResult;

/**
 * Thrown when a requested status change is not allowed from the customer's current status.
 * Maps to HTTP 409 - Conflict.
 */
public class InvalidTransitionException extends RuntimeException {

  private final transient TransitionResult result;

  public InvalidTransitionException(TransitionResult result) {
    super(result.error());
    this.result = result;
  }

  public TransitionResult getResult() {
    return result;
  }
}
