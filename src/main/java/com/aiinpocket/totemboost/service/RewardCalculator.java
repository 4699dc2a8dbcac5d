package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.model.enums.PremiumRewardTier;
import com.aiinpocket.totemboost.service.client.MeritManagerClient;
import com.aiinpocket.totemboost.service.client.MeritManagerClient.BoostPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 加持獎勵計算。
 *
 * <p>連續倍率 = min(100 + 5 × (連續天數 − 1), 245)%，第 30 天起封頂。
 * 所有乘法都先乘後除、無條件捨去。Mythum 加成期間再乘上功德帳本提供的倍率。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RewardCalculator {

    static final int BASE_MULTIPLIER_PCT = 100;
    static final int MULTIPLIER_STEP_PCT = 5;
    static final int MAX_MULTIPLIER_PCT = 245;

    private final MeritManagerClient meritManager;

    /**
     * 連續天數對應的倍率（百分比）。連續天數 0 視為 1。
     */
    public static int multiplierPct(int streakLength) {
        int days = Math.max(streakLength, 1);
        long pct = BASE_MULTIPLIER_PCT + (long) MULTIPLIER_STEP_PCT * (days - 1);
        return (int) Math.min(pct, MAX_MULTIPLIER_PCT);
    }

    /**
     * 免費加持獎勵。
     */
    public long freeReward(long basePoints, int streakLength) {
        return applyBoostPeriod(scale(basePoints, multiplierPct(streakLength)));
    }

    /**
     * 高級加持獎勵。streakLength 為請求當下的快照。
     */
    public long premiumReward(PremiumRewardTier tier, int streakLength) {
        return applyBoostPeriod(scale(tier.getBasePoints(), multiplierPct(streakLength)));
    }

    private long applyBoostPeriod(long reward) {
        BoostPeriod period = meritManager.currentBoostPeriod();
        if (!period.active()) {
            return reward;
        }
        int mythumPct = period.multiplierPct();
        long boosted = scale(reward, mythumPct);
        log.debug("[獎勵] Mythum 加成期 {}%：{} → {}", mythumPct, reward, boosted);
        return boosted;
    }

    private static long scale(long amount, int pct) {
        return Math.multiplyExact(amount, (long) pct) / 100;
    }
}
