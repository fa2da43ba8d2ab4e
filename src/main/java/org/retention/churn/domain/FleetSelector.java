package org.retention.churn.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Ranks many customers for the intervention work queue.
 */
@UtilityClass
public class FleetSelector {

  /**
   * Customers that require intervention, highest risk score first. Equal scores keep their input
   * order.
   *
   * @param customers customers to rank, iterated once in their natural order
   * @return a new list; the input is not modified
   */
  public static List<Customer> findHighRiskCustomers(Collection<Customer> customers) {
    // score once per customer; List.sort is a stable merge sort
    List<Scored> scored = customers.stream()
        .filter(Customer::requiresIntervention)
        .map(customer -> new Scored(customer, customer.calculateRiskScore()))
        .collect(Collectors.toList());
    scored.sort(Comparator.comparingInt(Scored::score).reversed());
    return scored.stream().map(Scored::customer).toList();
  }

  private record Scored(Customer customer, int score) {}
}
