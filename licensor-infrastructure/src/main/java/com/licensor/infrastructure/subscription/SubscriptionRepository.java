package com.licensor.infrastructure.subscription;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

  /**
   * SELECT ... FOR UPDATE. Holds the row until the surrounding transaction ends.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select s from SubscriptionEntity s where s.licenseKey = :licenseKey")
  Optional<SubscriptionEntity> findByLicenseKeyForUpdate(@Param("licenseKey") String licenseKey);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select s from SubscriptionEntity s where s.id = :id")
  Optional<SubscriptionEntity> findByIdForUpdate(@Param("id") UUID id);

  Optional<SubscriptionEntity> findByLicenseKey(String licenseKey);

  boolean existsByLicenseKey(String licenseKey);

  List<SubscriptionEntity> findByCustomerIdOrderByCreatedAtAsc(UUID customerId);
}
