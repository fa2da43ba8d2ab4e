package org.retention.churn.rest;

import static org.retention.churn.rest.ApiConstants.ApiPath.AT_RISK;
import static org.retention.churn.rest.ApiConstants.ApiPath.BASE_V1_API_PATH;
import static org.retention.churn.rest.ApiConstants.ApiPath.CUSTOMERS;
import static org.retention.churn.rest.ApiConstants.ApiPath.HIGH_RISK;
import static org.retention.churn.rest.ApiConstants.ApiPath.ID_PATH_VAR;
import static org.retention.churn.rest.ApiConstants.ApiPath.INTERVENTIONS;
import static org.retention.churn.rest.ApiConstants.ApiPath.RISK_FACTORS;
import static org.retention.churn.rest.ApiConstants.ApiPath.STATUS_PATH;
import static org.retention.churn.rest.ApiConstants.ApiPath.TRANSITIONS;
import static org.retention.churn.rest.ApiConstants.ApiPath.VALIDATION;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.retention.churn.domain.AtRiskIntake;
import org.retention.churn.domain.CustomerRecord;
import org.retention.churn.domain.CustomerView;
import org.retention.churn.domain.TransitionResult;
import org.retention.churn.domain.ValidationResult;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(
    name = "Customers",
    description = "Account lifecycle, risk scoring and intervention tracking for subscription customers.")
@RequestMapping(
    value = BASE_V1_API_PATH,
    produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public interface CustomerAPI {

  @Operation(summary = "Retrieve a customer by ID")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Customer found successfully"),
        @ApiResponse(responseCode = "404", description = "Customer not found"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
      })
  @GetMapping(value = CUSTOMERS + ID_PATH_VAR)
  ResponseEntity<CustomerView> getCustomer(@PathVariable @NotBlank String id);

  @GetMapping(value = CUSTOMERS)
  @Operation(summary = "List customers with keyset pagination")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Page of customers"),
      @ApiResponse(responseCode = "400", description = "Invalid limit")
  })
  ResponseEntity<CustomerPageResponse> getCustomers(
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
      @RequestParam(required = false) String after
  );

  @Operation(summary = "List customers in one account status")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Customers in the status"),
      @ApiResponse(responseCode = "400", description = "Unknown status")
  })
  @GetMapping(value = CUSTOMERS + STATUS_PATH)
  ResponseEntity<List<CustomerView>> getCustomersByStatus(@PathVariable String status);

  @Operation(summary = "Intervention queue: at-risk customers, highest risk score first")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Customers requiring intervention"),
      @ApiResponse(responseCode = "400", description = "Invalid limit")
  })
  @GetMapping(value = CUSTOMERS + HIGH_RISK)
  ResponseEntity<List<CustomerView>> getHighRiskCustomers(
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit);

  @Operation(summary = "Validate a stored customer and report every violation")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Validation result, valid or not"),
      @ApiResponse(responseCode = "404", description = "Customer not found")
  })
  @GetMapping(value = CUSTOMERS + ID_PATH_VAR + VALIDATION)
  ResponseEntity<ValidationResult> validateCustomer(@PathVariable @NotBlank String id);

  @Operation(summary = "Create a new customer")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Customer created successfully"),
        @ApiResponse(responseCode = "400", description = "Invalid customer data, every violation listed"),
        @ApiResponse(responseCode = "409", description = "Customer already exists"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
      })
  @PostMapping(value = CUSTOMERS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<CustomerView> createCustomer(@RequestBody CustomerRecord customer);

  @Operation(summary = "Start tracking a customer from a detected risk signal")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "At-risk customer created"),
      @ApiResponse(responseCode = "400", description = "Missing name, email or risk category")
  })
  @PostMapping(value = CUSTOMERS + AT_RISK, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<CustomerView> createAtRiskCustomer(@Valid @RequestBody AtRiskIntake intake);

  @Operation(summary = "Move a customer to another account status")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Transition applied"),
      @ApiResponse(responseCode = "404", description = "Customer not found"),
      @ApiResponse(responseCode = "409", description = "Transition not allowed from the current status")
  })
  @PostMapping(value = CUSTOMERS + ID_PATH_VAR + TRANSITIONS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<TransitionResult> transitionCustomer(
      @PathVariable @NotBlank String id, @Valid @RequestBody TransitionRequest request);

  @Operation(summary = "Record an intervention attempt")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Intervention recorded"),
      @ApiResponse(responseCode = "404", description = "Customer not found")
  })
  @PostMapping(value = CUSTOMERS + ID_PATH_VAR + INTERVENTIONS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<CustomerView> recordIntervention(
      @PathVariable @NotBlank String id, @Valid @RequestBody InterventionRequest request);

  @Operation(summary = "Add a risk factor")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Risk factor added"),
      @ApiResponse(responseCode = "404", description = "Customer not found")
  })
  @PostMapping(value = CUSTOMERS + ID_PATH_VAR + RISK_FACTORS, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<CustomerView> addRiskFactor(
      @PathVariable @NotBlank String id, @Valid @RequestBody RiskFactorRequest request);

  @Operation(summary = "Delete a customer")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Customer deleted successfully"),
        @ApiResponse(responseCode = "404", description = "Customer not found"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
      })
  @DeleteMapping(value = CUSTOMERS + ID_PATH_VAR)
  ResponseEntity<Void> deleteCustomer(@PathVariable @NotBlank String id);
}
