package com.aiinpocket.totemboost.model.dto;

import java.math.BigInteger;

/**
 * 高級加持請求的收據。獎勵要等預言機回呼後才入帳，這裡只有請求 ID。
 */
public record PremiumBoostReceipt(
        String requestId,
        String totem,
        int streakSnapshot,
        boolean graceDayGranted,
        BigInteger pricePaid,
        BigInteger refunded
) {}
