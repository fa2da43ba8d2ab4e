package org.retention.churn.rest;

import jakarta.validation.constraints.NotBlank;

public record RiskFactorRequest(@NotBlank String riskFactor) {}
