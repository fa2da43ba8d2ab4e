package org.retention.churn.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FleetSelectorTest {

  @Test
  @DisplayName("Should keep only customers requiring intervention, highest score first")
  void shouldFilterAndSortDescending() {
    Customer low = CustomerTestDataProvider.createAtRiskCustomer(
        RiskCategory.EXPIRING_CARD, RiskSeverity.LOW);
    Customer high = CustomerTestDataProvider.createAtRiskCustomer(
        RiskCategory.MULTIPLE_FAILURES, RiskSeverity.CRITICAL);
    Customer medium = CustomerTestDataProvider.createAtRiskCustomer(
        RiskCategory.FAILED_PAYMENT, RiskSeverity.MEDIUM);
    Customer active = CustomerTestDataProvider.createActiveCustomer();

    List<Customer> ranked = Customer.findHighRiskCustomers(List.of(low, active, high, medium));

    assertThat(ranked).containsExactly(high, medium, low);
  }

  @Test
  @DisplayName("Should keep input order for equal scores")
  void shouldBeStableForTies() {
    List<Customer> input = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      input.add(CustomerTestDataProvider.createAtRiskCustomer(
          RiskCategory.FAILED_PAYMENT, RiskSeverity.HIGH));
    }

    assertThat(FleetSelector.findHighRiskCustomers(input)).containsExactlyElementsOf(input);
  }

  @Test
  @DisplayName("Should skip at-risk customers without a category")
  void shouldSkipUncategorized() {
    Customer uncategorized = CustomerTestDataProvider.createAtRiskCustomer(null, RiskSeverity.HIGH);

    assertThat(FleetSelector.findHighRiskCustomers(List.of(uncategorized))).isEmpty();
  }

  @Test
  @DisplayName("Should not modify the input")
  void shouldNotModifyInput() {
    Customer first = CustomerTestDataProvider.createAtRiskCustomer(
        RiskCategory.EXPIRING_CARD, RiskSeverity.LOW);
    Customer second = CustomerTestDataProvider.createAtRiskCustomer(
        RiskCategory.MULTIPLE_FAILURES, RiskSeverity.HIGH);
    List<Customer> input = new ArrayList<>(List.of(first, second));

    FleetSelector.findHighRiskCustomers(input);

    assertThat(input).containsExactly(first, second);
  }
}
