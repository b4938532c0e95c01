package com.licensor.infrastructure.device;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DeviceRepository extends JpaRepository<DeviceEntity, UUID> {

  List<DeviceEntity> findBySubscriptionIdOrderByCreatedAtAscDeviceIdAsc(UUID subscriptionId);

  long countBySubscriptionId(UUID subscriptionId);
}
