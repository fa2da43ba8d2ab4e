package org.retention.churn.domain;

import io.hypersistence.tsid.TSID;
import java.time.Instant;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

/**
 * Back-office user working the intervention queue. Unlike {@link Customer}, every field that
 * matters is required, so construction fails fast instead of accumulating errors: an
 * {@code AdminUser} instance is always well formed.
 */
@Builder
public record AdminUser(
    String id,
    String name,
    String email,
    UserRole role,
    Instant lastLoginTime
) {

  public AdminUser {
    if (StringUtils.isBlank(name) || StringUtils.isBlank(email)) {
      throw new IllegalArgumentException("name and email are required for an admin user.");
    }
    if (!FieldFormats.isValidEmail(email)) {
      throw new IllegalArgumentException("Invalid email format.");
    }
    if (StringUtils.isBlank(id)) {
      id = "user_" + TSID.Factory.getTsid();
    }
    if (role == null) {
      role = UserRole.ADMIN;
    }
  }

  public AdminUser withLastLogin(Instant loginTime) {
    return new AdminUser(id, name, email, role, loginTime);
  }
}
