package com.aiinpocket.totemboost.model.dto;

import com.aiinpocket.totemboost.model.enums.PremiumRewardTier;

public record PremiumRewardResult(
        String requestId,
        String user,
        String totem,
        PremiumRewardTier tier,
        long rewardPoints
) {}
