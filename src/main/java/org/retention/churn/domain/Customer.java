package org.retention.churn.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.hypersistence.tsid.TSID;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.retention.churn.util.JsonUtils;

/**
 * Aggregate root of the churn domain: a subscription customer, its account lifecycle and the
 * risk signals that drive intervention priority.
 *
 * <p>State changes only through {@link #transitionTo(AccountStatus, String)}; the risk factor and
 * intervention lists only grow. Everything else is fixed at construction. Instances are not
 * thread-safe; callers serialize writes to one customer (see the service layer's optimistic
 * locking).
 *
 * <p>Builder defaults: status {@code active}, severity {@code low}, value 0, billing cycle
 * {@code monthly}, empty lists, {@code lastModified} now.
 */
@Getter
@Builder
@ToString
public class Customer {

  static final String ID_PREFIX = "cust_";
  static final String DEFAULT_BILLING_CYCLE = "monthly";

  private final String id;
  private final String name;
  private final String email;
  private final String phone;

  @Builder.Default
  private AccountStatus accountStatus = AccountStatus.ACTIVE;

  private RiskCategory riskCategory;

  @Builder.Default
  private RiskSeverity riskSeverity = RiskSeverity.LOW;

  private final String lastPaymentDate;

  @Builder.Default
  private Long accountValue = 0L;

  private final String customerSince;

  @Builder.Default
  private Instant lastModified = Instant.now();

  private final String serviceProvider;
  private final String serviceType;

  @Builder.Default
  private String billingCycle = DEFAULT_BILLING_CYCLE;

  private final String nextBillingDate;
  private final PaymentMethod paymentMethod;

  @Builder.Default
  private List<String> riskFactors = List.of();

  @Builder.Default
  private List<InterventionRecord> interventionHistory = List.of();

  // used by the builder and fromJSON; the lists are copied so callers cannot edit history
  private Customer(
      String id, String name, String email, String phone, AccountStatus accountStatus,
      RiskCategory riskCategory, RiskSeverity riskSeverity, String lastPaymentDate,
      Long accountValue, String customerSince, Instant lastModified, String serviceProvider,
      String serviceType, String billingCycle, String nextBillingDate, PaymentMethod paymentMethod,
      List<String> riskFactors, List<InterventionRecord> interventionHistory) {
    this.id = id;
    this.name = name;
    this.email = email;
    this.phone = phone;
    this.accountStatus = accountStatus;
    this.riskCategory = riskCategory;
    this.riskSeverity = riskSeverity;
    this.lastPaymentDate = lastPaymentDate;
    this.accountValue = accountValue;
    this.customerSince = customerSince;
    this.lastModified = lastModified;
    this.serviceProvider = serviceProvider;
    this.serviceType = serviceType;
    this.billingCycle = billingCycle;
    this.nextBillingDate = nextBillingDate;
    this.paymentMethod = paymentMethod;
    this.riskFactors = copyOf(riskFactors);
    this.interventionHistory = copyOf(interventionHistory);
  }

  // ---------------------------------------------------------------------------------------------
  // Validation
  // ---------------------------------------------------------------------------------------------

  /**
   * Checks structural and business rules, reporting every violation together.
   *
   * @see CustomerValidator
   */
  public ValidationResult validate() {
    return CustomerValidator.validate(this);
  }

  // ---------------------------------------------------------------------------------------------
  // State machine
  // ---------------------------------------------------------------------------------------------

  public boolean canTransitionTo(AccountStatus target) {
    return accountStatus != null && accountStatus.canTransitionTo(target);
  }

  /**
   * Moves the account to {@code target} if the lifecycle allows it.
   *
   * <p>A legal transition stamps {@code lastModified}; entering {@code resolved} or {@code churned}
   * also clears the risk category and resets severity to {@code low}. An illegal one changes
   * nothing and returns a failed result listing the legal targets.
   *
   * @param target status to move to
   * @param reason free text carried back in the result, may be null
   */
  public TransitionResult transitionTo(AccountStatus target, String reason) {
    if (!canTransitionTo(target)) {
      return TransitionResult.rejected(accountStatus, target);
    }
    AccountStatus previousStatus = accountStatus;
    accountStatus = target;
    lastModified = Instant.now();
    if (target.closesRisk()) {
      riskCategory = null;
      riskSeverity = RiskSeverity.LOW;
    }
    return TransitionResult.succeeded(previousStatus, target, reason, lastModified);
  }

  public TransitionResult transitionTo(AccountStatus target) {
    return transitionTo(target, null);
  }

  // ---------------------------------------------------------------------------------------------
  // Risk scoring
  // ---------------------------------------------------------------------------------------------

  public boolean requiresIntervention() {
    return accountStatus == AccountStatus.AT_RISK && riskCategory != null;
  }

  /**
   * @return priority in [0, 100], recomputed on every call
   * @see RiskScoreCalculator
   */
  public int calculateRiskScore() {
    return RiskScoreCalculator.score(this);
  }

  public String getStatusDescription() {
    if (accountStatus == null) {
      return "Unknown status";
    }
    return switch (accountStatus) {
      case ACTIVE -> "Active account with no issues";
      case AT_RISK -> "At risk - " + (riskCategory != null ? riskCategory.label() : "unknown issue");
      case RESOLVED -> "Issue resolved successfully";
      case CHURNED -> "Customer has churned";
    };
  }

  // ---------------------------------------------------------------------------------------------
  // Intervention tracking (append only)
  // ---------------------------------------------------------------------------------------------

  // lists are copy-on-write, so these views never change under a reader
  public List<String> getRiskFactors() {
    return riskFactors == null ? List.of() : Collections.unmodifiableList(riskFactors);
  }

  public List<InterventionRecord> getInterventionHistory() {
    return interventionHistory == null
        ? List.of()
        : Collections.unmodifiableList(interventionHistory);
  }

  public void recordIntervention(InterventionRecord intervention) {
    if (intervention == null) {
      throw new IllegalArgumentException("Intervention record must not be null");
    }
    interventionHistory = append(interventionHistory, intervention);
  }

  public void addRiskFactor(String riskFactor) {
    if (riskFactor == null) {
      throw new IllegalArgumentException("Risk factor must not be null");
    }
    riskFactors = append(riskFactors, riskFactor);
  }

  public Optional<InterventionRecord> lastIntervention() {
    List<InterventionRecord> history = getInterventionHistory();
    return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
  }

  private static <T> List<T> copyOf(List<T> list) {
    return list == null ? List.of() : new ArrayList<>(list);
  }

  private static <T> List<T> append(List<T> list, T element) {
    List<T> copy = list == null ? new ArrayList<>() : new ArrayList<>(list);
    copy.add(element);
    return copy;
  }

  // ---------------------------------------------------------------------------------------------
  // Serialization
  // ---------------------------------------------------------------------------------------------

  /**
   * Flat view with the derived {@code riskScore}, {@code statusDescription} and
   * {@code requiresIntervention} computed now.
   */
  public CustomerView toJSON() {
    return new CustomerView(
        id, name, email, phone, accountStatus, riskCategory, riskSeverity, lastPaymentDate,
        accountValue, customerSince, lastModified, serviceProvider, serviceType, billingCycle,
        nextBillingDate, paymentMethod, getRiskFactors(), getInterventionHistory(),
        calculateRiskScore(), getStatusDescription(), requiresIntervention());
  }

  /** Stored fields only. */
  public CustomerRecord toRecord() {
    return new CustomerRecord(
        id, name, email, phone, accountStatus, riskCategory, riskSeverity, lastPaymentDate,
        accountValue, customerSince, lastModified, serviceProvider, serviceType, billingCycle,
        nextBillingDate, paymentMethod, getRiskFactors(), getInterventionHistory());
  }

  /**
   * Rebuilds a customer, filling the same defaults as the builder for every absent field.
   */
  public static Customer fromJSON(CustomerRecord data) {
    if (data == null) {
      throw new IllegalArgumentException("Customer record must not be null");
    }
    return new Customer(
        data.id(),
        orEmpty(data.name()),
        orEmpty(data.email()),
        data.phone(),
        data.accountStatus() != null ? data.accountStatus() : AccountStatus.ACTIVE,
        data.riskCategory(),
        data.riskSeverity() != null ? data.riskSeverity() : RiskSeverity.LOW,
        data.lastPaymentDate(),
        data.accountValue() != null ? data.accountValue() : 0L,
        data.customerSince(),
        data.lastModified() != null ? data.lastModified() : Instant.now(),
        orEmpty(data.serviceProvider()),
        orEmpty(data.serviceType()),
        data.billingCycle() != null ? data.billingCycle() : DEFAULT_BILLING_CYCLE,
        data.nextBillingDate(),
        data.paymentMethod(),
        data.riskFactors() != null ? data.riskFactors() : List.of(),
        data.interventionHistory() != null ? data.interventionHistory() : List.of());
  }

  /**
   * Parses a JSON document, either a stored record or a {@link CustomerView}.
   *
   * @throws JsonProcessingException if the document is malformed or names an unknown status,
   *     category or severity
   */
  public static Customer fromJSON(String json) throws JsonProcessingException {
    return fromJSON(JsonUtils.fromJson(json, CustomerRecord.class));
  }

  private static String orEmpty(String value) {
    return value != null ? value : "";
  }

  // ---------------------------------------------------------------------------------------------
  // Factories and fleet helpers
  // ---------------------------------------------------------------------------------------------

  /**
   * Starts tracking someone from a detected risk signal: new id, status {@code at-risk}, severity
   * {@code medium} unless given, customer-since now unless given.
   */
  public static Customer createAtRiskCustomer(AtRiskIntake intake) {
    return Customer.builder()
        .id(newId())
        .name(intake.name())
        .email(intake.email())
        .accountStatus(AccountStatus.AT_RISK)
        .riskCategory(intake.riskCategory())
        .riskSeverity(intake.riskSeverity() != null ? intake.riskSeverity() : RiskSeverity.MEDIUM)
        .accountValue(intake.accountValue() != null ? intake.accountValue() : 0L)
        .customerSince(
            intake.customerSince() != null ? intake.customerSince() : Instant.now().toString())
        .lastPaymentDate(intake.lastPaymentDate())
        .serviceProvider("")
        .serviceType("")
        .build();
  }

  public static String newId() {
    return ID_PREFIX + TSID.Factory.getTsid();
  }

  /** @see FleetSelector#findHighRiskCustomers(Collection) */
  public static List<Customer> findHighRiskCustomers(Collection<Customer> customers) {
    return FleetSelector.findHighRiskCustomers(customers);
  }
}
