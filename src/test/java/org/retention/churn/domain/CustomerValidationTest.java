package org.retention.churn.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CustomerValidationTest {

  @Test
  @DisplayName("Should accept a fully populated customer")
  void shouldAcceptValidCustomer() {
    ValidationResult result = CustomerTestDataProvider.createFullCustomer().validate();

    assertThat(result.isValid()).isTrue();
    assertThat(result.errors()).isEmpty();
  }

  @Test
  @DisplayName("Should report every violation together, in check order")
  void shouldAccumulateAllErrors() {
    Customer customer = Customer.builder()
        .id("")
        .name("  ")
        .email("not-an-email")
        .accountStatus(AccountStatus.AT_RISK)
        .riskSeverity(null)
        .accountValue(-1L)
        .lastPaymentDate("yesterday")
        .customerSince("2024-13-01")
        .nextBillingDate("soon")
        .build();

    ValidationResult result = customer.validate();

    assertThat(result.isValid()).isFalse();
    assertThat(result.errors()).containsExactly(
        "Customer ID is required",
        "Customer name is required",
        "Email address must be valid format",
        "Risk category is required for at-risk customers",
        "Risk severity must be one of: low, medium, high, critical",
        "Account value must be a non-negative number",
        "Last payment date must be valid date format",
        "Customer since date must be valid date format",
        "Next billing date must be valid date format");
  }

  @Test
  @DisplayName("Should report a missing email once, without a format error")
  void shouldNotReportFormatForMissingEmail() {
    Customer customer = CustomerTestDataProvider.createActiveCustomer();
    Customer noEmail = Customer.fromJSON(customer.toRecord().toBuilder().email(null).build());

    assertThat(noEmail.validate().errors()).containsExactly("Email address is required");
  }

  @Test
  @DisplayName("Should report a missing status")
  void shouldReportMissingStatus() {
    Customer customer = Customer.builder()
        .id("cust_1")
        .name("Ada Lovelace")
        .email("ada@example.com")
        .accountStatus(null)
        .build();

    assertThat(customer.validate().errors())
        .containsExactly("Account status must be one of: active, at-risk, resolved, churned");
  }

  @Test
  @DisplayName("Should report a missing account value")
  void shouldReportMissingAccountValue() {
    Customer customer = Customer.builder()
        .id("cust_1")
        .name("Ada Lovelace")
        .email("ada@example.com")
        .accountValue(null)
        .build();

    assertThat(customer.validate().errors())
        .containsExactly("Account value must be a non-negative number");
  }

  @Test
  @DisplayName("Should not require a risk category outside at-risk")
  void shouldAllowActiveWithoutCategory() {
    Customer customer = CustomerTestDataProvider.createActiveCustomer();

    assertThat(customer.getRiskCategory()).isNull();
    assertThat(customer.validate().isValid()).isTrue();
  }

  @Test
  @DisplayName("Should skip date checks for absent dates")
  void shouldSkipAbsentDates() {
    Customer customer = Customer.builder()
        .id("cust_1")
        .name("Ada Lovelace")
        .email("ada@example.com")
        .build();

    assertThat(customer.validate().isValid()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"2024-01-31", "2024-01-31T10:15:30", "2024-01-31T10:15:30Z",
      "2024-01-31T10:15:30.123+01:00"})
  @DisplayName("Should accept ISO dates and date-times")
  void shouldAcceptIsoDates(String date) {
    assertThat(FieldFormats.isValidDate(date)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"2024-02-30", "31/01/2024", "tomorrow", " "})
  @DisplayName("Should reject malformed or impossible dates")
  void shouldRejectBadDates(String date) {
    assertThat(FieldFormats.isValidDate(date)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"plain", "a@b", "a b@c.io", "@c.io", "a@@c.io"})
  @DisplayName("Should reject malformed emails")
  void shouldRejectBadEmails(String email) {
    assertThat(FieldFormats.isValidEmail(email)).isFalse();
  }
}
