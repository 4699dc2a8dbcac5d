package com.aiinpocket.totemboost.service.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class HttpBadgeNftClient implements BadgeNftClient {

    private final RestClient badgeNftRestClient;

    @Override
    public void mint(String badgeContract, String user, int milestoneId) {
        ExternalCalls.run("BadgeNFT", () -> badgeNftRestClient.post()
                .uri("/contracts/{contract}/mint", badgeContract)
                .header("Content-Type", "application/json")
                .body(Map.of("to", user, "milestoneId", milestoneId))
                .retrieve()
                .toBodilessEntity());
    }
}
