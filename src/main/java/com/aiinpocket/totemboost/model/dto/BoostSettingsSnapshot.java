package com.aiinpocket.totemboost.model.dto;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 加持設定的不可變快照（快取用，避免把 JPA Entity 放進快取）。
 */
public record BoostSettingsSnapshot(
        long boostRewardPoints,
        BigInteger premiumBoostPrice,
        Duration freeBoostCooldown,
        String frontendSignerKey,
        String badgeNftAddress,
        boolean paused
) {}
