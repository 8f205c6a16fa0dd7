package com.cabinet.saas.infrastructure.personalvpn;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PersonalVpnInstanceRepository extends JpaRepository<PersonalVpnInstanceEntity, Long> {

  Optional<PersonalVpnInstanceEntity> findByOwnerUserId(Long ownerUserId);

  boolean existsByOwnerUserId(Long ownerUserId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select i from PersonalVpnInstanceEntity i where i.ownerUserId = :ownerUserId")
  Optional<PersonalVpnInstanceEntity> findByOwnerUserIdForUpdate(@Param("ownerUserId") Long ownerUserId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select i from PersonalVpnInstanceEntity i where i.id = :id")
  Optional<PersonalVpnInstanceEntity> findByIdForUpdate(@Param("id") Long id);
}
