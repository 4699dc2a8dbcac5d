package com.aiinpocket.totemboost.model.dto;

public record BadgeAvailability(
        int milestone,
        String displayName,
        String description,
        int available
) {}
