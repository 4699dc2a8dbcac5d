package com.aiinpocket.totemboost.service.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigInteger;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class HttpPaymentGatewayClient implements PaymentGatewayClient {

    private final RestClient paymentGatewayRestClient;

    @Override
    public void refund(String user, BigInteger amount) {
        ExternalCalls.run("PaymentGateway", () -> paymentGatewayRestClient.post()
                .uri("/refunds")
                .header("Content-Type", "application/json")
                .body(Map.of("to", user, "amount", amount.toString()))
                .retrieve()
                .toBodilessEntity());
        log.info("[付款] 退款 {} 給 {}", amount, user);
    }
}
