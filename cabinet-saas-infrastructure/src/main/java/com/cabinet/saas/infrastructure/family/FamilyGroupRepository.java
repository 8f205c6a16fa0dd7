package com.cabinet.saas.infrastructure.family;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface FamilyGroupRepository extends JpaRepository<FamilyGroupEntity, Long> {

  Optional<FamilyGroupEntity> findByOwnerUserId(Long ownerUserId);

  boolean existsByOwnerUserId(Long ownerUserId);

  boolean existsByOwnerUserIdAndIdNot(Long ownerUserId, Long excludedGroupId);

  /** SELECT ... FOR UPDATE; serializes capacity checks within one group. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select g from FamilyGroupEntity g where g.id = :id")
  Optional<FamilyGroupEntity> findByIdForUpdate(@Param("id") Long id);
}
