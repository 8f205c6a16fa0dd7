package com.cabinet.saas.infrastructure.notification;

import java.util.List;

/**
 * Offset paging for the notification inbox; derived queries only page by whole pages.
 */
public interface UserNotificationRepositoryCustom {

  /** Newest first. */
  List<UserNotificationEntity> findPage(Long userId, int offset, int limit);
}
