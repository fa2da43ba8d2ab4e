package org.retention.churn.domain;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Accumulate-and-report validation of a {@link Customer}. Every violation is collected so callers
 * can show all problems at once; nothing here throws for bad data.
 */
@UtilityClass
public class CustomerValidator {

  public static ValidationResult validate(Customer customer) {
    List<String> errors = new ArrayList<>();

    if (StringUtils.isEmpty(customer.getId())) {
      errors.add("Customer ID is required");
    }
    if (StringUtils.isBlank(customer.getName())) {
      errors.add("Customer name is required");
    }
    if (StringUtils.isBlank(customer.getEmail())) {
      errors.add("Email address is required");
    }
    if (StringUtils.isNotEmpty(customer.getEmail())
        && !FieldFormats.isValidEmail(customer.getEmail())) {
      errors.add("Email address must be valid format");
    }
    if (customer.getAccountStatus() == null) {
      errors.add("Account status must be one of: " + AccountStatus.allowedValues());
    }
    if (customer.getAccountStatus() == AccountStatus.AT_RISK && customer.getRiskCategory() == null) {
      errors.add("Risk category is required for at-risk customers");
    }
    if (customer.getRiskSeverity() == null) {
      errors.add("Risk severity must be one of: " + RiskSeverity.allowedValues());
    }
    if (customer.getAccountValue() == null || customer.getAccountValue() < 0) {
      errors.add("Account value must be a non-negative number");
    }
    checkDate(customer.getLastPaymentDate(), "Last payment date must be valid date format", errors);
    checkDate(customer.getCustomerSince(), "Customer since date must be valid date format", errors);
    checkDate(customer.getNextBillingDate(), "Next billing date must be valid date format", errors);

    return ValidationResult.of(errors);
  }

  private static void checkDate(String value, String message, List<String> errors) {
    if (StringUtils.isNotEmpty(value) && !FieldFormats.isValidDate(value)) {
      errors.add(message);
    }
  }
}
