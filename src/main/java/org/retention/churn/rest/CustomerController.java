package org.retention.churn.rest;

import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.retention.churn.domain.AccountStatus;
import org.retention.churn.domain.AtRiskIntake;
import org.retention.churn.domain.Customer;
import org.retention.churn.domain.CustomerRecord;
import org.retention.churn.domain.CustomerView;
import org.retention.churn.domain.TransitionResult;
import org.retention.churn.domain.ValidationResult;
import org.retention.churn.service.CustomerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for customer retention. Every customer leaves through {@link Customer#toJSON()},
 * so responses carry the risk score as of the request.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class CustomerController implements CustomerAPI {

  private final CustomerService customerService;

  @Override
  public ResponseEntity<CustomerView> getCustomer(String id) {
    log.debug("REST request to get Customer: {}", id);
    return ResponseEntity.ok(customerService.findById(id).toJSON());
  }

  @Override
  public ResponseEntity<CustomerPageResponse> getCustomers(int limit, String after) {
    log.info("Getting customers page: limit={}, after={}", limit, after);
    return ResponseEntity.ok(customerService.getCustomers(after, limit));
  }

  @Override
  public ResponseEntity<List<CustomerView>> getCustomersByStatus(String status) {
    log.debug("REST request to get Customers in status: {}", status);
    AccountStatus accountStatus = AccountStatus.fromValue(status);
    return ResponseEntity.ok(views(customerService.findByStatus(accountStatus)));
  }

  @Override
  public ResponseEntity<List<CustomerView>> getHighRiskCustomers(int limit) {
    log.debug("REST request for intervention queue, limit={}", limit);
    return ResponseEntity.ok(views(customerService.getInterventionQueue(limit)));
  }

  @Override
  public ResponseEntity<ValidationResult> validateCustomer(String id) {
    return ResponseEntity.ok(customerService.validate(id));
  }

  @Override
  public ResponseEntity<CustomerView> createCustomer(CustomerRecord customer) {
    log.debug("REST request to create Customer: {}", customer);
    return created(customerService.create(customer));
  }

  @Override
  public ResponseEntity<CustomerView> createAtRiskCustomer(AtRiskIntake intake) {
    log.debug("REST request to flag at-risk Customer: {}", intake);
    return created(customerService.flagAtRisk(intake));
  }

  @Override
  public ResponseEntity<TransitionResult> transitionCustomer(String id, TransitionRequest request) {
    log.debug("REST request to transition Customer {}: {}", id, request);
    return ResponseEntity.ok(
        customerService.transition(id, request.targetStatus(), request.reason()));
  }

  @Override
  public ResponseEntity<CustomerView> recordIntervention(String id, InterventionRequest request) {
    log.debug("REST request to record intervention for Customer {}: {}", id, request);
    return ResponseEntity.ok(customerService.recordIntervention(id, request.toRecord()).toJSON());
  }

  @Override
  public ResponseEntity<CustomerView> addRiskFactor(String id, RiskFactorRequest request) {
    log.debug("REST request to add risk factor for Customer {}: {}", id, request);
    return ResponseEntity.ok(customerService.addRiskFactor(id, request.riskFactor()).toJSON());
  }

  @Override
  public ResponseEntity<Void> deleteCustomer(String id) {
    log.debug("REST request to delete Customer: {}", id);
    customerService.delete(id);
    return ResponseEntity.noContent().build();
  }

  private static ResponseEntity<CustomerView> created(Customer customer) {
    return ResponseEntity
        .created(URI.create("/api/v1/customers/" + customer.getId()))
        .body(customer.toJSON());
  }

  private static List<CustomerView> views(List<Customer> customers) {
    return customers.stream().map(Customer::toJSON).toList();
  }
}
