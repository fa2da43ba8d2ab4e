package org.retention.churn.domain;

import java.util.List;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for customer rows. Status lookups read the jsonb document directly.
 */
@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, String> {

  @Query(value = "SELECT * FROM customers "
      + "WHERE customer_json->>'accountStatus' = :status "
      + "ORDER BY id ASC", nativeQuery = true)
  List<CustomerEntity> findByAccountStatus(@Param("status") String status);

  @Query("SELECT c FROM CustomerEntity c WHERE (:afterId IS NULL OR c.id > :afterId) ORDER BY c.id ASC")
  List<CustomerEntity> findNextPage(@Param("afterId") String afterId, Limit limit);

}
