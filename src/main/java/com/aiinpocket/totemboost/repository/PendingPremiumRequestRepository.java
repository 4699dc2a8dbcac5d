package com.aiinpocket.totemboost.repository;

import com.aiinpocket.totemboost.model.entity.PendingPremiumRequest;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface PendingPremiumRequestRepository extends JpaRepository<PendingPremiumRequest, String> {

    List<PendingPremiumRequest> findByUserAddressOrderByRequestedAtAsc(String userAddress);

    /** 超過指定時間仍未回呼的請求 */
    List<PendingPremiumRequest> findByRequestedAtBeforeOrderByRequestedAtAsc(Instant cutoff);

    long countByUserAddressAndTotemAddress(String userAddress, String totemAddress);
}
