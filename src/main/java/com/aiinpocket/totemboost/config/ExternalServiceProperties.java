package com.aiinpocket.totemboost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 外部協作服務的 HTTP 端點（prefix = boost.external）。
 */
@ConfigurationProperties(prefix = "boost.external")
public record ExternalServiceProperties(
        String meritManagerUrl,
        String treasuryUrl,
        String paymentGatewayUrl,
        String badgeNftUrl,
        String totemRegistryUrl,
        String randomnessOracleUrl,
        String oracleCallbackUrl
) {}
