package com.aiinpocket.totemboost.model.dto;

import java.math.BigInteger;
import java.util.List;

public record PremiumBoostConfig(
        BigInteger price,
        List<TierInfo> tiers
) {
    public record TierInfo(
            String tier,
            long basePoints,
            int chancePct
    ) {}
}
