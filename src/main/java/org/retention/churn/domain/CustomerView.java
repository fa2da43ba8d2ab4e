package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Serialized view of a customer: every stored field plus {@code riskScore},
 * {@code statusDescription} and {@code requiresIntervention}, computed when the view is built.
 * Never persist this shape; store {@link CustomerRecord} instead. Unset fields are written as
 * {@code null} whatever the mapper's default inclusion.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record CustomerView(
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
    List<InterventionRecord> interventionHistory,
    int riskScore,
    String statusDescription,
    boolean requiresIntervention
) {

  /** Stored fields only, for feeding a view back into {@link Customer#fromJSON(CustomerRecord)}. */
  public CustomerRecord toRecord() {
    return new CustomerRecord(
        id, name, email, phone, accountStatus, riskCategory, riskSeverity, lastPaymentDate,
        accountValue, customerSince, lastModified, serviceProvider, serviceType, billingCycle,
        nextBillingDate, paymentMethod, riskFactors, interventionHistory);
  }
}
