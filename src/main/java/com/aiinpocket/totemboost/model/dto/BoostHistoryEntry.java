package com.aiinpocket.totemboost.model.dto;

public record BoostHistoryEntry(
        Long id,
        String totem,
        String eventType,
        String eventData,
        String createdAt
) {}
