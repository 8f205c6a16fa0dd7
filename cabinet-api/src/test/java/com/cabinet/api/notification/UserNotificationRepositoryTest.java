package com.cabinet.api.notification;

import com.cabinet.saas.infrastructure.notification.UserNotificationEntity;
import com.cabinet.saas.infrastructure.notification.UserNotificationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class UserNotificationRepositoryTest {

  @Autowired UserNotificationRepository repo;

  @Test
  void pagesNewestFirstAndMarksAllRead() {
    Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
    for (int i = 0; i < 5; i++) {
      repo.save(new UserNotificationEntity(1L, "family_invite_received", "Family invitation", "n" + i, null, t0.plusSeconds(i)));
    }
    repo.save(new UserNotificationEntity(2L, "family_member_left", "Family member left", "other", null, t0));

    assertThat(repo.findPage(1L, 0, 2))
        .extracting(UserNotificationEntity::getBody)
        .containsExactly("n4", "n3");
    assertThat(repo.findPage(1L, 4, 10))
        .extracting(UserNotificationEntity::getBody)
        .containsExactly("n0");

    int updated = repo.markAllRead(1L, t0.plusSeconds(60));

    assertThat(updated).isEqualTo(5);
    assertThat(repo.countByUserIdAndReadAtIsNull(1L)).isZero();
    assertThat(repo.countByUserIdAndReadAtIsNull(2L)).isEqualTo(1);
  }
}
