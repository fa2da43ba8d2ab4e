package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lifecycle status of a subscription account.
 *
 * <pre>
 * ACTIVE → AT_RISK → RESOLVED
 *             ↑  ↘        |
 *             |   CHURNED |
 *             └───────────┘
 * </pre>
 *
 * CHURNED is terminal.
 */
public enum AccountStatus {
  ACTIVE("active"),
  AT_RISK("at-risk"),
  RESOLVED("resolved"),
  CHURNED("churned");

  private final String value;

  AccountStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Statuses reachable from this one, in declaration order.
   */
  public Set<AccountStatus> allowedTransitions() {
    return switch (this) {
      case ACTIVE -> EnumSet.of(AT_RISK);
      case AT_RISK -> EnumSet.of(RESOLVED, CHURNED);
      case RESOLVED -> EnumSet.of(AT_RISK);
      case CHURNED -> EnumSet.noneOf(AccountStatus.class);
    };
  }

  public boolean canTransitionTo(AccountStatus target) {
    return target != null && allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return allowedTransitions().isEmpty();
  }

  /**
   * Whether entering this status closes out the risk episode (category cleared, severity reset).
   */
  public boolean closesRisk() {
    return this == RESOLVED || this == CHURNED;
  }

  @JsonCreator
  public static AccountStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(
            "Account status must be one of: " + allowedValues() + " but was: " + value));
  }

  public static String allowedValues() {
    return join(List.of(values()));
  }

  static String join(Collection<AccountStatus> statuses) {
    return statuses.stream().map(AccountStatus::value).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return value;
  }
}
