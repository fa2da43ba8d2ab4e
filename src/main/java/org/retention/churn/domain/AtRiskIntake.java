package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

/**
 * Input of {@link Customer#createAtRiskCustomer(AtRiskIntake)}: a detected risk signal for someone
 * not yet on file. Name, email and category are structurally required, so construction fails fast.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AtRiskIntake(
    String name,
    String email,
    RiskCategory riskCategory,
    @PositiveOrZero Long accountValue,
    RiskSeverity riskSeverity,
    String customerSince,
    String lastPaymentDate
) {

  public AtRiskIntake {
    if (StringUtils.isBlank(name) || StringUtils.isBlank(email)) {
      throw new IllegalArgumentException("name and email are required for an at-risk intake.");
    }
    if (!FieldFormats.isValidEmail(email)) {
      throw new IllegalArgumentException("Invalid email format.");
    }
    if (riskCategory == null) {
      throw new IllegalArgumentException("riskCategory is required for an at-risk intake.");
    }
  }
}
