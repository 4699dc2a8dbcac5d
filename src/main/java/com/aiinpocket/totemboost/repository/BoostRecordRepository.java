package com.aiinpocket.totemboost.repository;

import com.aiinpocket.totemboost.model.entity.BoostRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BoostRecordRepository extends JpaRepository<BoostRecord, Long> {

    Optional<BoostRecord> findByUserAddressAndTotemAddress(String userAddress, String totemAddress);

    /** 依建立順序列出使用者所有圖騰紀錄（鑄造徽章時從最舊的紀錄扣） */
    List<BoostRecord> findByUserAddressOrderByIdAsc(String userAddress);
}
