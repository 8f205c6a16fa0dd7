package com.cabinet.saas.infrastructure.notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface UserNotificationRepository extends JpaRepository<UserNotificationEntity, Long>, UserNotificationRepositoryCustom {

  Optional<UserNotificationEntity> findByIdAndUserId(Long id, Long userId);

  long countByUserId(Long userId);

  long countByUserIdAndReadAtIsNull(Long userId);

  @Modifying
  @Query("update UserNotificationEntity n set n.readAt = :at where n.userId = :userId and n.readAt is null")
  int markAllRead(@Param("userId") Long userId, @Param("at") Instant at);
}
