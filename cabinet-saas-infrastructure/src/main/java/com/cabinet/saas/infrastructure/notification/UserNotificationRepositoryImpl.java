package com.cabinet.saas.infrastructure.notification;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class UserNotificationRepositoryImpl implements UserNotificationRepositoryCustom {

  @PersistenceContext
  private EntityManager em;

  @Override
  @Transactional(readOnly = true)
  public List<UserNotificationEntity> findPage(Long userId, int offset, int limit) {
    return em.createQuery(
        "SELECT n FROM UserNotificationEntity n " +
            "WHERE n.userId = :userId " +
            "ORDER BY n.createdAt DESC, n.id DESC",
        UserNotificationEntity.class
    )
        .setParameter("userId", userId)
        .setFirstResult(offset)
        .setMaxResults(limit)
        .getResultList();
  }
}
