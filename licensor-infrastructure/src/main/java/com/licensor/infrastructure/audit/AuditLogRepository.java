package com.licensor.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

  List<AuditLogEntity> findByTargetTypeAndTargetIdOrderByCreatedAtAsc(String targetType, String targetId);
}
