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
public class HttpTreasuryClient implements TreasuryClient {

    private final RestClient treasuryRestClient;

    @Override
    public void receive(BigInteger amount) {
        ExternalCalls.run("Treasury", () -> treasuryRestClient.post()
                .uri("/receipts")
                .header("Content-Type", "application/json")
                .body(Map.of("amount", amount.toString(), "source", "premium-boost"))
                .retrieve()
                .toBodilessEntity());
        log.info("[金庫] 收款 {}", amount);
    }
}
