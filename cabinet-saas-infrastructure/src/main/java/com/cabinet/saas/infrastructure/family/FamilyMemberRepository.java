package com.cabinet.saas.infrastructure.family;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FamilyMemberRepository extends JpaRepository<FamilyMemberEntity, Long> {

  Optional<FamilyMemberEntity> findFirstByUserIdAndStatus(Long userId, String status);

  Optional<FamilyMemberEntity> findByFamilyGroupIdAndUserId(Long familyGroupId, Long userId);

  long countByFamilyGroupIdAndStatus(Long familyGroupId, String status);

  boolean existsByUserIdAndStatus(Long userId, String status);

  boolean existsByUserIdAndStatusAndFamilyGroupIdNot(Long userId, String status, Long excludedGroupId);

  List<FamilyMemberEntity> findByFamilyGroupIdAndStatusInOrderByInvitedAtDesc(Long familyGroupId, Collection<String> statuses);

  @Query("select m.userId from FamilyMemberEntity m where m.familyGroupId = :groupId and m.status = :status")
  List<Long> findUserIdsByGroupAndStatus(@Param("groupId") Long groupId, @Param("status") String status);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("""
      select m from FamilyMemberEntity m
      where m.familyGroupId = :groupId and m.userId = :userId and m.status = :status
      """)
  Optional<FamilyMemberEntity> findForUpdate(
      @Param("groupId") Long groupId,
      @Param("userId") Long userId,
      @Param("status") String status
  );
}
