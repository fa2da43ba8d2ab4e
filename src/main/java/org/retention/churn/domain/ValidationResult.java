package org.retention.churn.domain;

import java.util.List;

/**
 * Outcome of accumulate-and-report validation.
 *
 * @param isValid true when {@code errors} is empty
 * @param errors every violation found, in check order
 */
public record ValidationResult(boolean isValid, List<String> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  public static ValidationResult of(List<String> errors) {
    return new ValidationResult(errors.isEmpty(), errors);
  }
}
