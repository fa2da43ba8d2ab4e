package org.retention.churn.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.jackson.JsonCloudEventData;
import io.hypersistence.tsid.TSID;
import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.retention.churn.domain.Customer;
import org.retention.churn.domain.TransitionResult;
import org.retention.churn.exception.CustomerServiceException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/*
 * Publishes customer lifecycle CloudEvents to Kafka. The event data is the customer's view,
 * derived risk fields included, as of the moment of publishing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CustomerEventPublisher {
  static final String TOPIC = "customer-events";
  static final String SOURCE = "/customer/events";
  private final KafkaTemplate<String, CloudEvent> kafkaTemplate;
  private final ObjectMapper objectMapper;

  // Event Types
  static final String EVENT_TYPE_CREATED = "Customer::created";
  static final String EVENT_TYPE_STATUS_CHANGED = "Customer::status-changed";
  static final String EVENT_TYPE_INTERVENTION_RECORDED = "Customer::intervention-recorded";
  static final String EVENT_TYPE_DELETED = "Customer::deleted";

  // Extension attributes (CloudEvents names are lowercase alphanumeric)
  static final String EXT_PREVIOUS_STATUS = "previousstatus";
  static final String EXT_NEW_STATUS = "newstatus";

  public void publishCustomerCreated(Customer customer) {
    publishEvent(EVENT_TYPE_CREATED, customer, Map.of());
  }

  public void publishStatusChanged(Customer customer, TransitionResult transition) {
    if (transition == null || !transition.success()) {
      throw new IllegalArgumentException("Only successful transitions are published");
    }
    publishEvent(EVENT_TYPE_STATUS_CHANGED, customer, Map.of(
        EXT_PREVIOUS_STATUS, transition.previousStatus().value(),
        EXT_NEW_STATUS, transition.newStatus().value()));
  }

  public void publishInterventionRecorded(Customer customer) {
    publishEvent(EVENT_TYPE_INTERVENTION_RECORDED, customer, Map.of());
  }

  public void publishCustomerDeleted(Customer customer) {
    publishEvent(EVENT_TYPE_DELETED, customer, Map.of());
  }

  private void publishEvent(String eventType, Customer customer, Map<String, String> extensions) {
    if (customer == null) {
      throw new IllegalArgumentException("Customer cannot be null");
    }
    if (customer.getId() == null) {
      throw new IllegalArgumentException("Customer ID cannot be null");
    }

    try {
      var customerJsonNode = objectMapper.valueToTree(customer.toJSON());
      var builder = CloudEventBuilder.v1()
          .withId(String.valueOf(TSID.Factory.getTsid().toLong()))
          .withSource(URI.create(SOURCE))
          .withType(eventType)
          .withTime(OffsetDateTime.now(ZoneOffset.UTC))
          .withSubject(customer.getId())
          .withDataContentType("application/json")
          .withData(JsonCloudEventData.wrap(customerJsonNode));
      extensions.forEach(builder::withExtension);
      var cloudEvent = builder.build();

      // keyed by customer so one customer's events stay ordered on a partition
      var result = kafkaTemplate.send(TOPIC, customer.getId(), cloudEvent)
          .get(5, TimeUnit.SECONDS);
      log.info("Published {} event for customer {} to partition {} offset {}",
               eventType, customer.getId(),
               result.getRecordMetadata().partition(),
               result.getRecordMetadata().offset());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CustomerServiceException("Kafka send interrupted", e);
    } catch (Exception e) {
      log.error("Error publishing {} event for customer {}: {}",
                eventType, customer.getId(), e.getMessage(), e);
      throw new CustomerServiceException("Failed to publish event", e);
    }
  }
}
