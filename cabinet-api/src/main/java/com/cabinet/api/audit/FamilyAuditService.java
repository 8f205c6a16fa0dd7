package com.cabinet.api.audit;

import com.cabinet.api.tracing.RequestContext;
import com.cabinet.saas.infrastructure.audit.AuditLogEntity;
import com.cabinet.saas.infrastructure.audit.AuditLogRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes audit rows inside the caller's transaction, so a rolled back transition leaves no trace.
 */
@Service
public class FamilyAuditService {

  public static final String TARGET_INVITE = "FAMILY_INVITE";
  public static final String TARGET_MEMBER = "FAMILY_MEMBER";
  public static final String TARGET_DEVICE = "FAMILY_DEVICE";
  public static final String TARGET_PERSONAL_VPN = "PERSONAL_VPN_INSTANCE";

  private final AuditLogRepository audits;
  private final Clock clock;

  public FamilyAuditService(AuditLogRepository audits, Clock clock) {
    this.audits = audits;
    this.clock = clock;
  }

  public void logUser(Long userId, String action, String targetType, Object targetId) {
    log("USER", userId, action, targetType, targetId);
  }

  public void logAdmin(Long adminId, String action, String targetType, Object targetId) {
    log("ADMIN", adminId, action, targetType, targetId);
  }

  private void log(String actorType, Long actorId, String action, String targetType, Object targetId) {
    audits.save(new AuditLogEntity(
        UUID.randomUUID(),
        actorType,
        actorId,
        action,
        targetType,
        String.valueOf(targetId),
        RequestContext.requestId(),
        clock.instant()
    ));
  }
}
