package org.retention.churn.exception;

import java.util.List;
import org.retention.churn.domain.ValidationResult;

/**
 * Thrown when a customer fails domain validation. Carries every violation, in check order.
 * Maps to HTTP 400 - Bad Request.
 */
public class CustomerValidationException extends RuntimeException {

  private final List<String> errors;

  public CustomerValidationException(ValidationResult result) {
    this(result.errors());
  }

  public CustomerValidationException(List<String> errors) {
    super("Customer validation failed: " + String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
