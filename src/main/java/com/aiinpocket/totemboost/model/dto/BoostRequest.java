package com.aiinpocket.totemboost.model.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 免費加持請求內容。timestamp 為 epoch 秒，signature 為前端簽章者的 Base64 DER 簽章。
 */
public record BoostRequest(
        long timestamp,
        @NotBlank String signature
) {}
