package com.aiinpocket.totemboost.repository;

import com.aiinpocket.totemboost.model.entity.BoostSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BoostSettingsRepository extends JpaRepository<BoostSettings, Long> {
}
