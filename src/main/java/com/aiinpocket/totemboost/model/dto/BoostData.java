package com.aiinpocket.totemboost.model.dto;

import java.time.Instant;
import java.util.Map;

public record BoostData(
        String user,
        String totem,
        Instant lastFreeBoostAt,
        Instant lastPremiumBoostAt,
        Instant streakAnchorAt,
        int streakLength,
        int graceDaysEarned,
        int graceDaysUsed,
        Map<Integer, Integer> unmintedBadges,
        long pendingPremiumRequests
) {}
