package com.cabinet.saas.infrastructure.family;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface FamilyDeviceRepository extends JpaRepository<FamilyDeviceEntity, Long> {

  List<FamilyDeviceEntity> findByFamilyGroupId(Long familyGroupId);

  List<FamilyDeviceEntity> findByFamilyGroupIdAndOwnerUserId(Long familyGroupId, Long ownerUserId);

  Optional<FamilyDeviceEntity> findByFamilyGroupIdAndHwid(Long familyGroupId, String hwid);
}
