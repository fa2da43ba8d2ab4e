package org.retention.churn.rest;

import jakarta.validation.constraints.NotBlank;
import org.apache.commons.lang3.StringUtils;
import org.retention.churn.domain.InterventionRecord;

/**
 * Body of an intervention request. A blank {@code date} means now.
 */
public record InterventionRequest(@NotBlank String outcome, String notes, String date) {

  InterventionRecord toRecord() {
    return StringUtils.isBlank(date)
        ? InterventionRecord.now(outcome, notes)
        : new InterventionRecord(date, outcome, notes);
  }
}
