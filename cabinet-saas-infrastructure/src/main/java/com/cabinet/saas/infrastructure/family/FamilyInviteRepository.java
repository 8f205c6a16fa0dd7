package com.cabinet.saas.infrastructure.family;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface FamilyInviteRepository extends JpaRepository<FamilyInviteEntity, Long> {

  boolean existsByFamilyGroupIdAndInviteeUserIdAndStatus(Long familyGroupId, Long inviteeUserId, String status);

  List<FamilyInviteEntity> findByFamilyGroupIdAndStatusOrderByCreatedAtDesc(Long familyGroupId, String status);

  List<FamilyInviteEntity> findByInviteeUserIdAndStatusOrderByCreatedAtDesc(Long inviteeUserId, String status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select i from FamilyInviteEntity i where i.id = :id")
  Optional<FamilyInviteEntity> findByIdForUpdate(@Param("id") Long id);
}
