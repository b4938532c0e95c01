package com.licensor.api.admin;

import com.licensor.api.tracing.RequestContext;
import com.licensor.application.ports.UnitOfWork;
import com.licensor.domain.subscription.Subscription;
import com.licensor.infrastructure.audit.AuditLogEntity;
import com.licensor.infrastructure.audit.AuditLogRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
public class AdminAuditService {

  private final AuditLogRepository audits;
  private final UnitOfWork unitOfWork;
  private final Clock clock;

  public AdminAuditService(AuditLogRepository audits, UnitOfWork unitOfWork, Clock clock) {
    this.audits = audits;
    this.unitOfWork = unitOfWork;
    this.clock = clock;
  }

  /**
   * Runs an admin mutation and writes its audit row in the same transaction: either both commit or neither does.
   * The lifecycle service's own unit of work joins the surrounding one.
   */
  public Subscription audited(String operator, String action, Supplier<Subscription> mutation,
                              Function<Subscription, String> detail) {
    return unitOfWork.execute(() -> {
      Subscription s = mutation.get();
      logAdmin(operator, action, s.id(), detail.apply(s));
      return s;
    });
  }

  private void logAdmin(String operator, String action, UUID subscriptionId, String detail) {
    audits.save(new AuditLogEntity(
        UUID.randomUUID(),
        operator == null ? "unknown" : operator,
        action,
        "subscription",
        subscriptionId.toString(),
        detail,
        RequestContext.requestId(),
        clock.instant()
    ));
  }
}
