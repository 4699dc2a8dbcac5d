package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.dto.BadgeAvailability;
import com.aiinpocket.totemboost.model.dto.BadgeMintResult;
import com.aiinpocket.totemboost.model.entity.BoostRecord;
import com.aiinpocket.totemboost.model.enums.BadgeMilestone;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.repository.BoostRecordRepository;
import com.aiinpocket.totemboost.service.client.BadgeNftClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;

/**
 * 里程碑徽章帳本。
 * 可鑄造數量分散在使用者各圖騰的 BoostRecord 上，查詢時加總，鑄造時從最舊的紀錄扣除。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadgeLedger {

    private final BoostRecordRepository recordRepo;
    private final BadgeNftClient badgeNftClient;

    /**
     * 使用者在所有圖騰上某里程碑的可鑄造徽章數。未知的里程碑回傳 0。
     */
    @Transactional(readOnly = true)
    public int available(String user, int milestoneDays) {
        return recordRepo.findByUserAddressOrderByIdAsc(user).stream()
                .mapToInt(r -> r.unmintedCount(milestoneDays))
                .sum();
    }

    /**
     * 所有里程碑的可鑄造數量。
     */
    @Transactional(readOnly = true)
    public List<BadgeAvailability> availableAll(String user) {
        List<BoostRecord> records = recordRepo.findByUserAddressOrderByIdAsc(user);
        return Arrays.stream(BadgeMilestone.values())
                .map(m -> new BadgeAvailability(
                        m.getDays(),
                        m.getDisplayName(),
                        m.getDescription(),
                        records.stream().mapToInt(r -> r.unmintedCount(m.getDays())).sum()))
                .toList();
    }

    /**
     * 鑄造一枚里程碑徽章。
     *
     * @throws BoostException MILESTONE_NOT_ACHIEVED 若沒有可鑄造的次數
     */
    @Transactional
    public BadgeMintResult mintBadge(String user, int milestoneDays, String badgeContract) {
        BadgeMilestone milestone = BadgeMilestone.ofDays(milestoneDays)
                .orElseThrow(() -> new BoostException(BoostError.MILESTONE_NOT_ACHIEVED,
                        "不存在的里程碑: " + milestoneDays));

        List<BoostRecord> records = recordRepo.findByUserAddressOrderByIdAsc(user);
        BoostRecord source = records.stream()
                .filter(r -> r.unmintedCount(milestoneDays) > 0)
                .findFirst()
                .orElseThrow(() -> new BoostException(BoostError.MILESTONE_NOT_ACHIEVED));

        if (badgeContract == null) {
            throw new BoostException(BoostError.EXTERNAL_SERVICE_UNAVAILABLE, "徽章合約尚未設定");
        }

        int left = source.unmintedCount(milestoneDays) - 1;
        if (left == 0) {
            source.getUnmintedBadges().remove(milestoneDays);
        } else {
            source.getUnmintedBadges().put(milestoneDays, left);
        }
        recordRepo.saveAndFlush(source);

        badgeNftClient.mint(badgeContract, user, milestoneDays);

        int remaining = records.stream().mapToInt(r -> r.unmintedCount(milestoneDays)).sum();
        log.info("[徽章] 用戶 {} 鑄造徽章 {}（{} 天），剩餘可鑄造 {}",
                user, milestone.getDisplayName(), milestoneDays, remaining);
        return new BadgeMintResult(milestoneDays, badgeContract, remaining);
    }
}
