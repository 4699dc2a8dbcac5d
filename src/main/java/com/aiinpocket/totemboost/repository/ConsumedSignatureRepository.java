package com.aiinpocket.totemboost.repository;

import com.aiinpocket.totemboost.model.entity.ConsumedSignature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface ConsumedSignatureRepository extends JpaRepository<ConsumedSignature, String> {

    /** 刪除簽章時間早於 cutoff 的紀錄（這些簽章本來就會因過期被拒絕） */
    @Modifying
    @Transactional
    @Query("DELETE FROM ConsumedSignature c WHERE c.signedAt < :cutoff")
    int deleteSignedBefore(@Param("cutoff") Instant cutoff);
}
