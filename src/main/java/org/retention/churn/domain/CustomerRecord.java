package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Stored shape of a customer: what the persistence layer writes and what
 * {@link Customer#fromJSON(CustomerRecord)} reads. Absent fields are defaulted by
 * {@code fromJSON}. Derived values ({@code riskScore} and friends) are ignored on read.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomerRecord(
    String id,
    String name,
    String email,
    String phone,
    AccountStatus accountStatus,
    RiskCategory riskCategory,
    RiskSeverity riskSeverity,
    String lastPaymentDate,
    Long accountValue,
    String customerSince,
    Instant lastModified,
    String serviceProvider,
    String serviceType,
    String billingCycle,
    String nextBillingDate,
    PaymentMethod paymentMethod,
    List<String> riskFactors,
    List<InterventionRecord> interventionHistory
) {}
