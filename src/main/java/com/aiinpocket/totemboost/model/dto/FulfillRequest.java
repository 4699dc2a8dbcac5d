package com.aiinpocket.totemboost.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.math.BigInteger;
import java.util.List;

/**
 * 預言機回呼內容。
 */
public record FulfillRequest(
        @NotBlank String requestId,
        @NotEmpty List<BigInteger> randomWords
) {}
