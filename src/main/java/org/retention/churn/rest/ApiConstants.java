package org.retention.churn.rest;

public final class ApiConstants {
  public static final class ApiPath {
    public static final String BASE_V1_API_PATH = "/api/v1";
    public static final String CUSTOMERS = "/customers";
    public static final String ID_PATH_VAR = "/{id}";
    public static final String STATUS_PATH = "/status/{status}";
    public static final String HIGH_RISK = "/high-risk";
    public static final String AT_RISK = "/at-risk";
    public static final String VALIDATION = "/validation";
    public static final String TRANSITIONS = "/transitions";
    public static final String INTERVENTIONS = "/interventions";
    public static final String RISK_FACTORS = "/risk-factors";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
