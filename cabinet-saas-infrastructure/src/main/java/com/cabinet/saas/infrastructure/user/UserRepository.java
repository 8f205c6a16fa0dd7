package com.cabinet.saas.infrastructure.user;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<UserEntity, Long> {

  Optional<UserEntity> findFirstByUsernameIgnoreCaseOrderByIdAsc(String username);

  Optional<UserEntity> findByTelegramId(Long telegramId);
}
