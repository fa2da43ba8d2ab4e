package org.retention.churn.domain;

import java.time.Instant;

/**
 * One attempt, human or automated, to resolve an at-risk account. The outcome is stored verbatim;
 * see {@link InterventionOutcome} for the values reporting understands.
 */
public record InterventionRecord(
    String date,
    String outcome,
    String notes
) {

  public static InterventionRecord now(String outcome, String notes) {
    return new InterventionRecord(Instant.now().toString(), outcome, notes);
  }
}
