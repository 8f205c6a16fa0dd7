package com.cabinet.saas.infrastructure.personalvpn;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PersonalVpnUserRepository extends JpaRepository<PersonalVpnUserEntity, Long> {

  long countByInstanceIdAndDeletedAtIsNull(Long instanceId);

  List<PersonalVpnUserEntity> findByInstanceIdAndDeletedAtIsNullOrderByCreatedAtDesc(Long instanceId);

  Optional<PersonalVpnUserEntity> findByIdAndInstanceIdAndDeletedAtIsNull(Long id, Long instanceId);
}
