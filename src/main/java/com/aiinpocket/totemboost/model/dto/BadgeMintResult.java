package com.aiinpocket.totemboost.model.dto;

public record BadgeMintResult(
        int milestone,
        String badgeContract,
        int remaining
) {}
