package org.retention.churn.domain;

import lombok.Builder;

/**
 * Snapshot of the card on file. Owned by {@link Customer} and replaced wholesale, never edited in
 * place.
 */
@Builder
public record PaymentMethod(
    String id,
    String cardType,
    String lastFourDigits,
    Integer expiryMonth,
    Integer expiryYear,
    String status,
    int failureCount,
    String lastFailureDate,
    String lastSuccessDate
) {}
