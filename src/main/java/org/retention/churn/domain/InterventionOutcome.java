package org.retention.churn.domain;

import java.util.Arrays;

/**
 * Intervention outcomes understood by downstream reporting. Unknown outcomes are still accepted
 * and stored as given.
 */
public enum InterventionOutcome {
  SUCCESS("success"),
  FAILED("failed"),
  NO_ANSWER("no-answer"),
  SCHEDULED("scheduled");

  private final String value;

  InterventionOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static boolean isRecognized(String outcome) {
    return outcome != null
        && Arrays.stream(values()).anyMatch(o -> o.value.equalsIgnoreCase(outcome.trim()));
  }
}
