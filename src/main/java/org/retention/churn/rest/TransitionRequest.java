package org.retention.churn.rest;

import jakarta.validation.constraints.NotNull;
import org.retention.churn.domain.AccountStatus;

/**
 * Body of a status change request. {@code reason} is free text echoed back in the result.
 */
public record TransitionRequest(@NotNull AccountStatus targetStatus, String reason) {}
