package org.retention.churn.domain;

import lombok.experimental.UtilityClass;

/**
 * Intervention priority on a 0-100 scale. Pure function of the customer's current state; the
 * score is never stored.
 *
 * <pre>
 * score = round(min(100, base(category) * multiplier(severity)
 *                        + min(accountValue / 10000, 25)
 *                        + min(failureCount * 5, 15)
 *                        + min(riskFactors * 2, 10)))
 * </pre>
 *
 * Customers that are not at risk score 0.
 */
@UtilityClass
public class RiskScoreCalculator {

  static final int MAX_SCORE = 100;
  static final double VALUE_DIVISOR = 10_000.0;
  static final double MAX_VALUE_BONUS = 25;
  static final int FAILURE_WEIGHT = 5;
  static final int MAX_FAILURE_BONUS = 15;
  static final int RISK_FACTOR_WEIGHT = 2;
  static final int MAX_RISK_FACTOR_BONUS = 10;

  public static int score(Customer customer) {
    if (customer.getAccountStatus() != AccountStatus.AT_RISK) {
      return 0;
    }
    double weighted = baseScore(customer.getRiskCategory()) * multiplier(customer.getRiskSeverity());
    double total = weighted
        + valueBonus(customer.getAccountValue())
        + failureBonus(customer.getPaymentMethod())
        + riskFactorBonus(customer.getRiskFactors().size());
    return (int) Math.round(Math.min(MAX_SCORE, total));
  }

  static int baseScore(RiskCategory category) {
    return category == null ? RiskCategory.UNCLASSIFIED_BASE_SCORE : category.baseScore();
  }

  static double multiplier(RiskSeverity severity) {
    return severity == null ? RiskSeverity.DEFAULT_MULTIPLIER : severity.multiplier();
  }

  static double valueBonus(Long accountValueCents) {
    if (accountValueCents == null || accountValueCents <= 0) {
      return 0;
    }
    return Math.min(accountValueCents / VALUE_DIVISOR, MAX_VALUE_BONUS);
  }

  static int failureBonus(PaymentMethod paymentMethod) {
    if (paymentMethod == null) {
      return 0;
    }
    return Math.min(Math.max(paymentMethod.failureCount(), 0) * FAILURE_WEIGHT, MAX_FAILURE_BONUS);
  }

  static int riskFactorBonus(int riskFactorCount) {
    return Math.min(riskFactorCount * RISK_FACTOR_WEIGHT, MAX_RISK_FACTOR_BONUS);
  }
}
