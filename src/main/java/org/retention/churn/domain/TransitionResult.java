package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Result of {@link Customer#transitionTo(AccountStatus, String)}. An illegal transition is an
 * expected business outcome, so it is reported here rather than thrown.
 *
 * <p>On success {@code previousStatus}, {@code newStatus}, {@code reason} and {@code timestamp}
 * are set. On failure {@code error}, {@code previousStatus} (unchanged), {@code attemptedStatus}
 * and {@code allowedTransitions} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransitionResult(
    boolean success,
    String error,
    AccountStatus previousStatus,
    AccountStatus newStatus,
    AccountStatus attemptedStatus,
    String reason,
    Instant timestamp,
    List<AccountStatus> allowedTransitions
) {

  static TransitionResult succeeded(
      AccountStatus previousStatus, AccountStatus newStatus, String reason, Instant timestamp) {
    return new TransitionResult(
        true, null, previousStatus, newStatus, null, reason, timestamp, null);
  }

  static TransitionResult rejected(AccountStatus from, AccountStatus to) {
    Set<AccountStatus> allowed = from == null ? Set.of() : from.allowedTransitions();
    String valid = allowed.isEmpty() ? "none" : AccountStatus.join(allowed);
    String error = "Cannot transition from " + from + " to " + to + ". Valid transitions: " + valid;
    return new TransitionResult(false, error, from, null, to, null, null, List.copyOf(allowed));
  }
}
