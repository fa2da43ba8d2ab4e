package org.retention.churn.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class AccountStateMachineTest {

  static Stream<Arguments> allStatusPairs() {
    return Stream.of(AccountStatus.values())
        .flatMap(from -> Stream.of(AccountStatus.values()).map(to -> Arguments.of(from, to)));
  }

  private static Customer customerIn(AccountStatus status) {
    return Customer.builder()
        .id("cust_sm")
        .name("Grace Hopper")
        .email("grace@example.com")
        .accountStatus(status)
        .riskCategory(status == AccountStatus.AT_RISK ? RiskCategory.FAILED_PAYMENT : null)
        .riskSeverity(status == AccountStatus.AT_RISK ? RiskSeverity.HIGH : RiskSeverity.LOW)
        .lastModified(Instant.parse("2024-01-01T00:00:00Z"))
        .build();
  }

  // ---- Transition table ----

  @ParameterizedTest(name = "{0} -> {1}")
  @MethodSource("allStatusPairs")
  @DisplayName("canTransitionTo should agree with transitionTo for every pair")
  void canTransitionToAgreesWithTransitionTo(AccountStatus from, AccountStatus to) {
    Customer customer = customerIn(from);
    boolean allowed = customer.canTransitionTo(to);

    TransitionResult result = customer.transitionTo(to);

    assertThat(result.success()).isEqualTo(allowed);
    assertThat(customer.getAccountStatus()).isEqualTo(allowed ? to : from);
  }

  @Test
  @DisplayName("Should allow exactly the documented transitions")
  void shouldAllowDocumentedTransitions() {
    assertThat(AccountStatus.ACTIVE.allowedTransitions()).containsExactly(AccountStatus.AT_RISK);
    assertThat(AccountStatus.AT_RISK.allowedTransitions())
        .containsExactly(AccountStatus.RESOLVED, AccountStatus.CHURNED);
    assertThat(AccountStatus.RESOLVED.allowedTransitions()).containsExactly(AccountStatus.AT_RISK);
    assertThat(AccountStatus.CHURNED.allowedTransitions()).isEmpty();
    assertThat(AccountStatus.CHURNED.isTerminal()).isTrue();
  }

  @Test
  @DisplayName("Should reject null as a target")
  void shouldRejectNullTarget() {
    Customer customer = customerIn(AccountStatus.ACTIVE);

    assertThat(customer.canTransitionTo(null)).isFalse();
    TransitionResult result = customer.transitionTo(null);

    assertThat(result.success()).isFalse();
    assertThat(customer.getAccountStatus()).isEqualTo(AccountStatus.ACTIVE);
  }

  // ---- Effects of a legal transition ----

  @Test
  @DisplayName("Should stamp lastModified and echo the reason on success")
  void shouldStampLastModified() {
    Customer customer = customerIn(AccountStatus.ACTIVE);
    Instant before = customer.getLastModified();

    TransitionResult result = customer.transitionTo(AccountStatus.AT_RISK, "card expiring");

    assertThat(result.success()).isTrue();
    assertThat(result.previousStatus()).isEqualTo(AccountStatus.ACTIVE);
    assertThat(result.newStatus()).isEqualTo(AccountStatus.AT_RISK);
    assertThat(result.reason()).isEqualTo("card expiring");
    assertThat(result.error()).isNull();
    assertThat(customer.getLastModified()).isAfter(before).isEqualTo(result.timestamp());
  }

  @ParameterizedTest
  @EnumSource(value = AccountStatus.class, names = {"RESOLVED", "CHURNED"})
  @DisplayName("Should clear risk fields when leaving at-risk")
  void shouldClearRiskFieldsOnClose(AccountStatus target) {
    Customer customer = customerIn(AccountStatus.AT_RISK);

    customer.transitionTo(target);

    assertThat(customer.getRiskCategory()).isNull();
    assertThat(customer.getRiskSeverity()).isEqualTo(RiskSeverity.LOW);
    assertThat(customer.calculateRiskScore()).isZero();
  }

  @Test
  @DisplayName("Should keep risk fields when entering at-risk")
  void shouldKeepRiskFieldsWhenEnteringAtRisk() {
    Customer customer = customerIn(AccountStatus.RESOLVED);

    customer.transitionTo(AccountStatus.AT_RISK);

    assertThat(customer.getAccountStatus()).isEqualTo(AccountStatus.AT_RISK);
    assertThat(customer.getRiskSeverity()).isEqualTo(RiskSeverity.LOW);
  }

  // ---- Rejections ----

  @Test
  @DisplayName("Should reject active -> resolved, listing at-risk as the only option")
  void shouldRejectActiveToResolved() {
    Customer customer = customerIn(AccountStatus.ACTIVE);
    Instant before = customer.getLastModified();

    TransitionResult result = customer.transitionTo(AccountStatus.RESOLVED, "ignored");

    assertThat(result.success()).isFalse();
    assertThat(result.error())
        .isEqualTo("Cannot transition from active to resolved. Valid transitions: at-risk");
    assertThat(result.previousStatus()).isEqualTo(AccountStatus.ACTIVE);
    assertThat(result.attemptedStatus()).isEqualTo(AccountStatus.RESOLVED);
    assertThat(result.allowedTransitions()).containsExactly(AccountStatus.AT_RISK);
    assertThat(customer.getAccountStatus()).isEqualTo(AccountStatus.ACTIVE);
    assertThat(customer.getLastModified()).isEqualTo(before);
  }

  @Test
  @DisplayName("Should keep churned customers churned")
  void shouldKeepChurnedTerminal() {
    Customer customer = customerIn(AccountStatus.CHURNED);

    for (AccountStatus target : AccountStatus.values()) {
      TransitionResult result = customer.transitionTo(target);
      assertThat(result.success()).isFalse();
      assertThat(result.allowedTransitions()).isEqualTo(List.of());
    }
    assertThat(customer.transitionTo(AccountStatus.ACTIVE).error())
        .isEqualTo("Cannot transition from churned to active. Valid transitions: none");
    assertThat(customer.getAccountStatus()).isEqualTo(AccountStatus.CHURNED);
  }

  // ---- Wire values ----

  @Test
  @DisplayName("Should parse wire values case-insensitively and reject unknown ones")
  void shouldParseWireValues() {
    assertThat(AccountStatus.fromValue("AT-RISK")).isEqualTo(AccountStatus.AT_RISK);
    assertThat(AccountStatus.AT_RISK).hasToString("at-risk");
    assertThatThrownBy(() -> AccountStatus.fromValue("dormant"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("active, at-risk, resolved, churned");
  }
}
