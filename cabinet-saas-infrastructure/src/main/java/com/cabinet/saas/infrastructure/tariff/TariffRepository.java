package com.cabinet.saas.infrastructure.tariff;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TariffRepository extends JpaRepository<TariffEntity, Long> {
}
