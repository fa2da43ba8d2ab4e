package org.retention.churn.service;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.retention.churn.domain.Customer;
import org.retention.churn.domain.CustomerRecord;
import org.retention.churn.domain.ValidationResult;
import org.retention.churn.util.JsonUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Imports customers from a JSON file at startup. Each record is rebuilt with its construction
 * defaults and validated; unreadable or invalid records and ids already stored are skipped with a
 * warning, so one bad record never stops the rest from loading.
 * Does nothing when {@code churn.seed.path} is blank.
 */
@Component
@Slf4j
public class CustomerSeedLoader implements ApplicationRunner {

  private final CustomerService customerService;
  private final String seedPath;
  private final String rootPath;

  public CustomerSeedLoader(
      CustomerService customerService,
      @Value("${churn.seed.path:}") String seedPath,
      @Value("${churn.seed.root-path:$.customers}") String rootPath) {
    this.customerService = customerService;
    this.seedPath = seedPath;
    this.rootPath = rootPath;
  }

  @Override
  public void run(ApplicationArguments args) throws IOException {
    if (StringUtils.isBlank(seedPath)) {
      log.debug("No seed file configured");
      return;
    }
    SeedReport report = load(seedPath);
    log.info("Seeded customers from {}: imported={} skipped={} invalid={}",
        seedPath, report.imported(), report.skipped(), report.invalid());
  }

  /**
   * @throws IOException if the file cannot be read or is not valid JSON
   */
  SeedReport load(String path) throws IOException {
    String json = JsonUtils.readJsonFromFile(path);
    Object extracted = JsonUtils.extractValue(json, rootPath).orElse(List.of());
    List<Object> records = JsonUtils.convertValue(extracted, new TypeReference<List<Object>>() {});

    int imported = 0;
    int skipped = 0;
    int invalid = 0;
    for (int i = 0; i < records.size(); i++) {
      CustomerRecord seed;
      try {
        seed = JsonUtils.convertValue(records.get(i), new TypeReference<CustomerRecord>() {});
      } catch (IllegalArgumentException e) {
        // unknown enum value or wrong field type
        log.warn("Skipping unreadable seed customer at index {}: {}", i, e.getMessage());
        invalid++;
        continue;
      }
      Customer customer = Customer.fromJSON(seed);
      ValidationResult validation = customer.validate();
      if (!validation.isValid()) {
        log.warn("Skipping invalid seed customer {}: {}", customer.getId(), validation.errors());
        invalid++;
      } else if (customerService.importCustomer(customer)) {
        imported++;
      } else {
        log.warn("Skipping seed customer {}: already present", customer.getId());
        skipped++;
      }
    }
    return new SeedReport(imported, skipped, invalid);
  }

  record SeedReport(int imported, int skipped, int invalid) {}
}
