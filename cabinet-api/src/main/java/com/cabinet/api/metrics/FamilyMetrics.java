package com.cabinet.api.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Family coordinator counters.
 *
 * Exposes:
 * - cabinet.family.invites.created / cabinet.family.invites.accepted
 * - cabinet.family.conflicts (commit-time races reported as retryable conflicts)
 * - cabinet.family.notifications.failed (fan-out rows rolled back)
 * - cabinet.family.devices.remote_delete_failed (per hwid)
 */
@Component
public class FamilyMetrics {

  private final Counter invitesCreated;
  private final Counter invitesAccepted;
  private final Counter conflicts;
  private final Counter notificationsFailed;
  private final Counter remoteDeleteFailed;

  public FamilyMetrics(MeterRegistry registry) {
    this.invitesCreated = Counter.builder("cabinet.family.invites.created")
        .description("Family invites issued")
        .register(registry);
    this.invitesAccepted = Counter.builder("cabinet.family.invites.accepted")
        .description("Family invites accepted")
        .register(registry);
    this.conflicts = Counter.builder("cabinet.family.conflicts")
        .description("Membership transitions rejected by a commit-time constraint")
        .register(registry);
    this.notificationsFailed = Counter.builder("cabinet.family.notifications.failed")
        .description("Notifications that could not be stored or pushed")
        .register(registry);
    this.remoteDeleteFailed = Counter.builder("cabinet.family.devices.remote_delete_failed")
        .description("Panel device deletions that failed during cleanup")
        .register(registry);
  }

  public void incInvitesCreated() {
    invitesCreated.increment();
  }

  public void incInvitesAccepted() {
    invitesAccepted.increment();
  }

  public void incConflicts() {
    conflicts.increment();
  }

  public void incNotificationsFailed() {
    notificationsFailed.increment();
  }

  public void incRemoteDeleteFailed() {
    remoteDeleteFailed.increment();
  }
}
