package com.aiinpocket.totemboost.repository;

import com.aiinpocket.totemboost.model.entity.BoostEventLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BoostEventLogRepository extends JpaRepository<BoostEventLog, Long> {

    List<BoostEventLog> findByUserAddressOrderByCreatedAtDesc(String userAddress, Pageable pageable);
}
