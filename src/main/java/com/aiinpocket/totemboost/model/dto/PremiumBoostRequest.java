package com.aiinpocket.totemboost.model.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * 高級加持請求內容。payment 為隨請求附帶的金額（最小單位），超過價格的部分會退回。
 */
public record PremiumBoostRequest(
        @NotNull BigInteger payment
) {}
