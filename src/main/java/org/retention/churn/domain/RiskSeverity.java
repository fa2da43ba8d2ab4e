package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Four-level urgency scale. The multiplier scales the category base score.
 */
public enum RiskSeverity {
  LOW("low", 0.7),
  MEDIUM("medium", 1.0),
  HIGH("high", 1.4),
  CRITICAL("critical", 1.8);

  /** Multiplier applied when no severity is set. */
  public static final double DEFAULT_MULTIPLIER = 1.0;

  private final String value;
  private final double multiplier;

  RiskSeverity(String value, double multiplier) {
    this.value = value;
    this.multiplier = multiplier;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public double multiplier() {
    return multiplier;
  }

  @JsonCreator
  public static RiskSeverity fromValue(String value) {
    return Arrays.stream(values())
        .filter(severity -> severity.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(
            "Risk severity must be one of: " + allowedValues() + " but was: " + value));
  }

  public static String allowedValues() {
    return Arrays.stream(values()).map(RiskSeverity::value).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return value;
  }
}
