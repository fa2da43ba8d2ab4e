package org.retention.churn.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum UserRole {
  ADMIN("admin"),
  SUPERVISOR("supervisor");

  private final String value;

  UserRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static UserRole fromValue(String value) {
    return Arrays.stream(values())
        .filter(role -> role.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown user role: " + value));
  }
}
