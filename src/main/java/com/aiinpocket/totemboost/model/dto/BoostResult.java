package com.aiinpocket.totemboost.model.dto;

import java.util.List;

public record BoostResult(
        String totem,
        int streakLength,
        boolean graceDayGranted,
        boolean streakReset,
        long rewardPoints,
        List<Integer> milestonesReached
) {}
