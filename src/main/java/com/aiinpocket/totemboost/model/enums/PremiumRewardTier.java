package com.aiinpocket.totemboost.model.enums;

import lombok.Getter;

import java.math.BigInteger;

/**
 * 高級加持獎勵等級。以隨機數 mod 100 落在累積機率區間決定等級。
 */
@Getter
public enum PremiumRewardTier {

    COMMON(500, 50),
    UNCOMMON(700, 25),
    RARE(1000, 15),
    EPIC(2000, 7),
    LEGENDARY(3000, 3);

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final long basePoints;
    /** 機率（百分比），全部加總為 100 */
    private final int chancePct;

    PremiumRewardTier(long basePoints, int chancePct) {
        this.basePoints = basePoints;
        this.chancePct = chancePct;
    }

    /**
     * 依隨機數決定獎勵等級。
     * roll = randomWord mod 100，依序累加機率，第一個累積值大於 roll 的等級即為結果。
     */
    public static PremiumRewardTier fromRandomWord(BigInteger randomWord) {
        int roll = randomWord.mod(HUNDRED).intValue();
        int cumulative = 0;
        for (PremiumRewardTier tier : values()) {
            cumulative += tier.chancePct;
            if (roll < cumulative) {
                return tier;
            }
        }
        // 機率總和為 100，不會走到這裡
        return LEGENDARY;
    }
}
