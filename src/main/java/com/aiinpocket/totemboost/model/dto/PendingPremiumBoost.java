package com.aiinpocket.totemboost.model.dto;

public record PendingPremiumBoost(
        String requestId,
        String totem,
        int streakSnapshot,
        String requestedAt
) {}
