package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Classified root cause of an at-risk account, with the base score it contributes to the
 * intervention priority.
 */
public enum RiskCategory {
  EXPIRING_CARD("expiring-card", 40),
  FAILED_PAYMENT("failed-payment", 70),
  MULTIPLE_FAILURES("multiple-failures", 85);

  /** Base score used when an at-risk customer has no category. */
  public static final int UNCLASSIFIED_BASE_SCORE = 20;

  private final String value;
  private final int baseScore;

  RiskCategory(String value, int baseScore) {
    this.value = value;
    this.baseScore = baseScore;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int baseScore() {
    return baseScore;
  }

  /** Human readable form, e.g. "failed payment". */
  public String label() {
    return value.replace('-', ' ');
  }

  @JsonCreator
  public static RiskCategory fromValue(String value) {
    return Arrays.stream(values())
        .filter(category -> category.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(
            "Risk category must be one of: " + allowedValues() + " but was: " + value));
  }

  public static String allowedValues() {
    return Arrays.stream(values()).map(RiskCategory::value).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return value;
  }
}
