package com.licensor.infrastructure.audit;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per operator mutation. {@code actor_id} is the operator's username (token subject).
 */
@Entity
@Table(
    name = "audit_log",
    indexes = {
        @Index(name = "ix_audit_log_created_at", columnList = "created_at"),
        @Index(name = "ix_audit_log_target", columnList = "target_type,target_id")
    }
)
public class AuditLogEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "actor_id", nullable = false, length = 128)
  private String actorId;

  @Column(name = "action", nullable = false, length = 128)
  private String action;

  @Column(name = "target_type", nullable = false, length = 64)
  private String targetType;

  @Column(name = "target_id", nullable = false, length = 128)
  private String targetId;

  @Column(name = "detail", length = 1024)
  private String detail;

  @Column(name = "request_id", length = 128)
  private String requestId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected AuditLogEntity() {}

  public AuditLogEntity(UUID id, String actorId, String action, String targetType, String targetId,
                        String detail, String requestId, Instant createdAt) {
    this.id = id;
    this.actorId = actorId;
    this.action = action;
    this.targetType = targetType;
    this.targetId = targetId;
    this.detail = detail;
    this.requestId = requestId;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getActorId() { return actorId; }
  public String getAction() { return action; }
  public String getTargetType() { return targetType; }
  public String getTargetId() { return targetId; }
  public String getDetail() { return detail; }
  public String getRequestId() { return requestId; }
  public Instant getCreatedAt() { return createdAt; }
}
