package com.aiinpocket.totemboost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/**
 * 加持引擎設定（prefix = boost）。
 *
 * <p>其中 boostRewardPoints、premiumBoostPrice、freeBoostCooldown、frontendSignerKey、
 * badgeNftAddress 只作為初始值，啟動時寫入 BoostSettings，之後由管理員 API 調整。
 */
@ConfigurationProperties(prefix = "boost")
public record BoostProperties(
        Duration freeBoostCooldown,
        int graceDayInterval,
        Duration signatureTolerance,
        long boostRewardPoints,
        BigInteger premiumBoostPrice,
        BigInteger minTotemBalance,
        String frontendSignerKey,
        String badgeNftAddress,
        List<String> managers,
        String oracleAddress,
        Duration pendingRequestStaleAfter
) {}
