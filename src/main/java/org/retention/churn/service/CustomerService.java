package org.retention.churn.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.retention.churn.domain.AccountStatus;
import org.retention.churn.domain.AtRiskIntake;
import org.retention.churn.domain.Customer;
import org.retention.churn.domain.CustomerEntity;
import org.retention.churn.domain.CustomerRecord;
import org.retention.churn.domain.CustomerRepository;
import org.retention.churn.domain.FleetSelector;
import org.retention.churn.domain.InterventionOutcome;
import org.retention.churn.domain.InterventionRecord;
import org.retention.churn.domain.TransitionResult;
import org.retention.churn.domain.ValidationResult;
import org.retention.churn.exception.CustomerConflictException;
import org.retention.churn.exception.CustomerNotFoundException;
import org.retention.churn.exception.CustomerServiceException;
import org.retention.churn.exception.CustomerValidationException;
import org.retention.churn.exception.InvalidTransitionException;
import org.retention.churn.exception.ServiceUnavailableException;
import org.retention.churn.rest.CustomerPageResponse;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service layer for the churn domain.
 * Loads customers from their stored record, applies the domain operation, writes the record back
 * in the same transaction and publishes an event for every lifecycle change.
 *
 * <p>Writes to one customer are serialized by the entity's version column: a concurrent update
 * surfaces as {@link CustomerConflictException}.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

  private final CustomerRepository customerRepository;
  private final ObjectMapper objectMapper;
  private final CustomerEventPublisher eventPublisher;

  /**
   * Retrieve a customer by their ID.
   *
   * @throws CustomerNotFoundException if no customer is found with the given ID
   */
  public Customer findById(String id) {
    log.info("Finding customer by ID: {}", id);
    try {
      Customer customer = convertToCustomer(loadEntity(id));
      log.info("Successfully found customer with ID: {}", id);
      log.debug("Retrieved customer details: {}", customer);
      return customer;
    } catch (Exception e) {
      log.error("Error finding customer with ID: {}", id, e);
      return translateAndThrow(e, "Error retrieving customer with ID: " + id);
    }
  }

  /**
   * Keyset page ordered by id. Fetches one extra row to learn whether another page exists.
   *
   * @param after id of the last customer on the previous page, null for the first page
   * @param limit page size
   */
  public CustomerPageResponse getCustomers(String after, int limit) {
    log.info("Retrieving customers page after={} limit={}", after, limit);
    try {
      List<CustomerEntity> rows = customerRepository.findNextPage(
          StringUtils.isBlank(after) ? null : after, Limit.of(limit + 1));
      boolean hasMore = rows.size() > limit;
      List<CustomerEntity> page = hasMore ? rows.subList(0, limit) : rows;
      String nextCursor = hasMore ? page.get(page.size() - 1).getId() : null;
      var data = page.stream().map(this::convertToCustomer).map(Customer::toJSON).toList();
      log.info("Retrieved {} customers, hasMore={}", data.size(), hasMore);
      return new CustomerPageResponse(data, nextCursor, hasMore, limit);
    } catch (Exception e) {
      log.error("Failed to retrieve customers page after {}", after, e);
      return translateAndThrow(e, "Error retrieving customers page");
    }
  }

  public List<Customer> findByStatus(AccountStatus status) {
    log.info("Finding customers with status: {}", status);
    if (status == null) {
      throw new IllegalArgumentException("Account status must not be null.");
    }
    try {
      List<Customer> customers = customerRepository.findByAccountStatus(status.value()).stream()
          .map(this::convertToCustomer)
          .toList();
      log.info("Found {} customers with status {}", customers.size(), status);
      return customers;
    } catch (Exception e) {
      log.error("Failed to find customers with status {}", status, e);
      return translateAndThrow(e, "Error retrieving customers with status " + status);
    }
  }

  /**
   * At-risk customers that need outreach, highest risk score first.
   *
   * @param limit maximum number of customers returned
   */
  public List<Customer> getInterventionQueue(int limit) {
    log.info("Building intervention queue, limit={}", limit);
    // only at-risk customers can require intervention
    List<Customer> queue = FleetSelector.findHighRiskCustomers(findByStatus(AccountStatus.AT_RISK));
    log.info("{} customers require intervention", queue.size());
    return queue.size() > limit ? queue.subList(0, limit) : queue;
  }

  /**
   * Create a customer from a stored-shape record. Absent fields get their construction defaults
   * and a blank id is replaced with a generated one.
   *
   * @throws CustomerValidationException listing every rule the record breaks
   * @throws CustomerConflictException if a customer with the same ID already exists
   */
  @Transactional
  public Customer create(CustomerRecord customerRecord) {
    log.info("Starting customer creation process");
    log.debug("Input customer data: {}", customerRecord);
    if (customerRecord == null) {
      throw new IllegalArgumentException("Customer must not be null.");
    }
    CustomerRecord withId = StringUtils.isBlank(customerRecord.id())
        ? customerRecord.toBuilder().id(Customer.newId()).build()
        : customerRecord;
    Customer customer = Customer.fromJSON(withId);
    requireValid(customer);
    return insert(customer, "Error creating customer");
  }

  /**
   * Start tracking a customer from a detected risk signal.
   */
  @Transactional
  public Customer flagAtRisk(AtRiskIntake intake) {
    log.info("Flagging new at-risk customer, category={}", intake.riskCategory());
    Customer customer = Customer.createAtRiskCustomer(intake);
    requireValid(customer);
    return insert(customer, "Error creating at-risk customer");
  }

  /**
   * Move a customer through the account lifecycle.
   *
   * @throws InvalidTransitionException if the lifecycle does not allow the move; nothing is
   *     written in that case
   */
  @Transactional
  public TransitionResult transition(String id, AccountStatus target, String reason) {
    log.info("Transitioning customer {} to {}", id, target);
    try {
      CustomerEntity entity = loadEntity(id);
      Customer customer = convertToCustomer(entity);
      TransitionResult result = customer.transitionTo(target, reason);
      if (!result.success()) {
        log.warn("Rejected transition for customer {}: {}", id, result.error());
        throw new InvalidTransitionException(result);
      }
      save(entity, customer);
      log.info("Customer {} moved from {} to {}", id, result.previousStatus(), result.newStatus());

      eventPublisher.publishStatusChanged(customer, result);
      return result;
    } catch (Exception e) {
      log.error("Failed to transition customer {} to {}", id, target, e);
      return translateAndThrow(e, "Error transitioning customer with ID: " + id);
    }
  }

  @Transactional
  public Customer recordIntervention(String id, InterventionRecord intervention) {
    log.info("Recording intervention for customer {}", id);
    log.debug("Intervention: {}", intervention);
    try {
      CustomerEntity entity = loadEntity(id);
      Customer customer = convertToCustomer(entity);
      customer.recordIntervention(intervention);
      if (!InterventionOutcome.isRecognized(intervention.outcome())) {
        log.warn("Customer {}: intervention outcome '{}' is not one reporting recognizes",
            id, intervention.outcome());
      }
      save(entity, customer);
      log.info("Customer {} now has {} interventions", id, customer.getInterventionHistory().size());

      eventPublisher.publishInterventionRecorded(customer);
      return customer;
    } catch (Exception e) {
      log.error("Failed to record intervention for customer {}", id, e);
      return translateAndThrow(e, "Error recording intervention for customer with ID: " + id);
    }
  }

  @Transactional
  public Customer addRiskFactor(String id, String riskFactor) {
    log.info("Adding risk factor '{}' to customer {}", riskFactor, id);
    try {
      CustomerEntity entity = loadEntity(id);
      Customer customer = convertToCustomer(entity);
      customer.addRiskFactor(riskFactor);
      save(entity, customer);
      return customer;
    } catch (Exception e) {
      log.error("Failed to add risk factor to customer {}", id, e);
      return translateAndThrow(e, "Error adding risk factor to customer with ID: " + id);
    }
  }

  /**
   * Re-run validation against a stored customer. Invalid data is reported, not thrown.
   */
  public ValidationResult validate(String id) {
    ValidationResult result = findById(id).validate();
    log.info("Validation of customer {}: valid={} errors={}", id, result.isValid(),
        result.errors().size());
    return result;
  }

  /**
   * Delete a customer by their ID.
   * Publishes a deletion event after removing the customer.
   *
   * @throws CustomerNotFoundException if the customer does not exist
   */
  @Transactional
  public void delete(String id) {
    log.info("Starting customer deletion process for ID: {}", id);
    var customer = findById(id);
    try {
      log.info("Deleting customer from database");
      customerRepository.deleteById(id);
      customerRepository.flush();
      log.info("Successfully deleted customer from database");

      eventPublisher.publishCustomerDeleted(customer);
    } catch (Exception e) {
      log.error("Failed to delete customer with ID: {}", id, e);
      translateAndThrow(e, "Error deleting customer with ID: " + id);
    }
  }

  /**
   * Store a customer loaded from seed data. No event is published.
   *
   * @return false if a customer with the same ID is already stored
   */
  @Transactional
  public boolean importCustomer(Customer customer) {
    if (customerRepository.existsById(customer.getId())) {
      log.debug("Customer {} already present, not importing", customer.getId());
      return false;
    }
    try {
      CustomerEntity entity = CustomerEntity.builder().id(customer.getId()).build();
      save(entity, customer);
      log.debug("Imported customer {}", customer.getId());
      return true;
    } catch (Exception e) {
      log.error("Failed to import customer {}", customer.getId(), e);
      return translateAndThrow(e, "Error importing customer with ID: " + customer.getId());
    }
  }

  private Customer insert(Customer customer, String contextMessage) {
    if (customerRepository.existsById(customer.getId())) {
      log.error("Customer with ID {} already exists", customer.getId());
      throw new CustomerConflictException("Customer with ID " + customer.getId() + " already exists.");
    }
    try {
      CustomerEntity entity = CustomerEntity.builder().id(customer.getId()).build();
      log.info("Saving customer to database");
      save(entity, customer);
      log.info("Successfully saved customer with ID: {}", customer.getId());

      eventPublisher.publishCustomerCreated(customer);
      return customer;
    } catch (Exception e) {
      log.error("Failed to create customer {}", customer.getId(), e);
      return translateAndThrow(e, contextMessage);
    }
  }

  private void requireValid(Customer customer) {
    ValidationResult result = customer.validate();
    if (!result.isValid()) {
      log.warn("Customer {} failed validation: {}", customer.getId(), result.errors());
      throw new CustomerValidationException(result);
    }
  }

  private CustomerEntity loadEntity(String id) {
    if (StringUtils.isBlank(id)) {
      throw new IllegalArgumentException("Customer ID must not be blank.");
    }
    return customerRepository.findById(id)
        .orElseThrow(() -> new CustomerNotFoundException("Customer with ID " + id + " not found."));
  }

  private void save(CustomerEntity entity, Customer customer) throws JsonProcessingException {
    entity.setCustomerJson(objectMapper.writeValueAsString(customer.toRecord()));
    customerRepository.saveAndFlush(entity);
  }

  /**
   * @throws CustomerServiceException if the stored document cannot be read back
   */
  private Customer convertToCustomer(CustomerEntity entity) {
    try {
      CustomerRecord stored = objectMapper.readValue(entity.getCustomerJson(), CustomerRecord.class);
      return Customer.fromJSON(stored);
    } catch (JsonProcessingException e) {
      log.error("Failed to convert entity to customer: {}", entity, e);
      throw new CustomerServiceException("Error converting JSON to customer", e);
    }
  }

  /**
   * Translates Spring Data exceptions into application exceptions, which the ControllerAdvice maps
   * to HTTP status codes. Application exceptions and argument errors pass through unchanged.
   *
   * @return Never returns - always throws an exception
   */
  private <T> T translateAndThrow(Exception e, String contextMessage) {
    if (e instanceof CustomerNotFoundException
        || e instanceof CustomerConflictException
        || e instanceof CustomerValidationException
        || e instanceof InvalidTransitionException
        || e instanceof ServiceUnavailableException
        || e instanceof CustomerServiceException
        || e instanceof IllegalArgumentException) {
      throw (RuntimeException) e;
    }

    RuntimeException translatedEx;
    if (e instanceof EmptyResultDataAccessException) {
      log.debug("Resource not found: {}", contextMessage);
      translatedEx = new CustomerNotFoundException(contextMessage, e);
    } else if (e instanceof OptimisticLockingFailureException) {
      log.warn("Concurrent modification: {}", contextMessage);
      translatedEx = new CustomerConflictException(
          contextMessage + " The customer was modified concurrently.", e);
    } else if (e instanceof DataIntegrityViolationException) {
      log.warn("Data integrity violation: {}", contextMessage);
      translatedEx = new CustomerConflictException(contextMessage + " Possible constraint violation.", e);
    } else if (e instanceof QueryTimeoutException) {
      log.error("Database query timeout: {}", contextMessage);
      translatedEx = new ServiceUnavailableException(contextMessage + " due to query timing out.", e);
    } else if (e instanceof TransientDataAccessResourceException) {
      log.error("Transient database error: {}", contextMessage);
      translatedEx = new ServiceUnavailableException(
          contextMessage + " due to a transient resource issue.", e);
    } else if (e instanceof DataAccessException) {
      log.error("Database access error: {}", contextMessage);
      translatedEx = new CustomerServiceException(contextMessage + " due to data access error.", e);
    } else {
      log.error("Unexpected error: {}", contextMessage);
      translatedEx = new CustomerServiceException(contextMessage + " due to unexpected error.", e);
    }

    log.debug("Translated {} to {}", e.getClass().getSimpleName(), translatedEx.getClass().getSimpleName());
    throw translatedEx;
  }
}
