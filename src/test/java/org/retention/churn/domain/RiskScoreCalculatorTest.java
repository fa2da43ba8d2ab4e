package org.retention.churn.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class RiskScoreCalculatorTest {

  private static Customer.CustomerBuilder atRisk(RiskCategory category, RiskSeverity severity) {
    return Customer.builder()
        .id("cust_score")
        .name("Alan Turing")
        .email("alan@example.com")
        .accountStatus(AccountStatus.AT_RISK)
        .riskCategory(category)
        .riskSeverity(severity);
  }

  @ParameterizedTest(name = "{0} x {1} = {2}")
  @CsvSource({
      "EXPIRING_CARD, LOW, 28",
      "EXPIRING_CARD, MEDIUM, 40",
      "FAILED_PAYMENT, HIGH, 98",
      "MULTIPLE_FAILURES, MEDIUM, 85",
      "MULTIPLE_FAILURES, CRITICAL, 100"
  })
  @DisplayName("Should weight the category base score by severity")
  void shouldWeightBaseScore(RiskCategory category, RiskSeverity severity, int expected) {
    assertThat(atRisk(category, severity).build().calculateRiskScore()).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should cap the score at 100")
  void shouldCapAtHundred() {
    Customer customer = atRisk(RiskCategory.MULTIPLE_FAILURES, RiskSeverity.CRITICAL)
        .accountValue(500_000L)
        .paymentMethod(CustomerTestDataProvider.createFailingCard(5))
        .riskFactors(List.of("a", "b", "c"))
        .build();

    assertThat(customer.calculateRiskScore()).isEqualTo(100);
  }

  @Test
  @DisplayName("Should score 0 for an active customer regardless of risk fields")
  void shouldScoreZeroWhenActive() {
    Customer customer = atRisk(RiskCategory.MULTIPLE_FAILURES, RiskSeverity.CRITICAL)
        .accountStatus(AccountStatus.ACTIVE)
        .accountValue(500_000L)
        .build();

    assertThat(customer.calculateRiskScore()).isZero();
    assertThat(customer.requiresIntervention()).isFalse();
  }

  @ParameterizedTest
  @EnumSource(value = AccountStatus.class, names = {"ACTIVE", "RESOLVED", "CHURNED"})
  @DisplayName("Should score 0 off at-risk")
  void shouldScoreZeroOffAtRisk(AccountStatus status) {
    Customer customer = atRisk(RiskCategory.FAILED_PAYMENT, RiskSeverity.HIGH)
        .accountStatus(status)
        .build();

    assertThat(customer.calculateRiskScore()).isZero();
  }

  @Test
  @DisplayName("Should add each bonus up to its own cap")
  void shouldAddCappedBonuses() {
    // 40 * 1.0 = 40, value 50_000 -> 5, failures 2 -> 10, factors 2 -> 4
    Customer customer = atRisk(RiskCategory.EXPIRING_CARD, RiskSeverity.MEDIUM)
        .accountValue(50_000L)
        .paymentMethod(CustomerTestDataProvider.createFailingCard(2))
        .riskFactors(List.of("late", "downgrade"))
        .build();

    assertThat(customer.calculateRiskScore()).isEqualTo(59);

    assertThat(RiskScoreCalculator.valueBonus(10_000_000L)).isEqualTo(25.0);
    assertThat(RiskScoreCalculator.failureBonus(CustomerTestDataProvider.createFailingCard(9)))
        .isEqualTo(15);
    assertThat(RiskScoreCalculator.riskFactorBonus(12)).isEqualTo(10);
  }

  @Test
  @DisplayName("Should ignore negative value and failure counts")
  void shouldIgnoreNegativeInputs() {
    assertThat(RiskScoreCalculator.valueBonus(-5_000L)).isZero();
    assertThat(RiskScoreCalculator.valueBonus(null)).isZero();
    assertThat(RiskScoreCalculator.failureBonus(CustomerTestDataProvider.createFailingCard(-3)))
        .isZero();
    assertThat(RiskScoreCalculator.failureBonus(null)).isZero();
  }

  @Test
  @DisplayName("Should fall back to base 20 and multiplier 1.0 when risk fields are absent")
  void shouldUseFallbacksForMissingRiskFields() {
    Customer customer = atRisk(null, null).build();

    assertThat(customer.calculateRiskScore()).isEqualTo(20);
    assertThat(customer.requiresIntervention()).isFalse();
  }

  @Test
  @DisplayName("Should be idempotent and stay within [0, 100]")
  void shouldBeIdempotentAndBounded() {
    Customer customer = CustomerTestDataProvider.createFullCustomer();

    int first = customer.calculateRiskScore();

    assertThat(customer.calculateRiskScore()).isEqualTo(first);
    assertThat(first).isBetween(0, 100);
  }

  @Test
  @DisplayName("Should describe the status in words")
  void shouldDescribeStatus() {
    assertThat(atRisk(RiskCategory.EXPIRING_CARD, RiskSeverity.LOW).build().getStatusDescription())
        .isEqualTo("At risk - expiring card");
    assertThat(atRisk(null, RiskSeverity.LOW).build().getStatusDescription())
        .isEqualTo("At risk - unknown issue");
    assertThat(atRisk(null, null).accountStatus(AccountStatus.CHURNED).build()
        .getStatusDescription()).isEqualTo("Customer has churned");
  }
}
