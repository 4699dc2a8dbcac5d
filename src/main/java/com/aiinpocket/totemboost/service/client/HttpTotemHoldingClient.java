package com.aiinpocket.totemboost.service.client;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigInteger;

@Component
@RequiredArgsConstructor
public class HttpTotemHoldingClient implements TotemHoldingClient {

    private final RestClient totemRegistryRestClient;

    @Override
    public TotemHolding holdingOf(String totem, String user) {
        HoldingResponse response = ExternalCalls.call("TotemRegistry", () -> totemRegistryRestClient.get()
                .uri("/totems/{totem}/holders/{user}", totem, user)
                .retrieve()
                .body(HoldingResponse.class));
        if (response == null) {
            return TotemHolding.NONE;
        }
        return new TotemHolding(
                response.tokenBalance() != null ? response.tokenBalance() : BigInteger.ZERO,
                response.nftBalance() != null ? response.nftBalance() : BigInteger.ZERO);
    }

    record HoldingResponse(BigInteger tokenBalance, BigInteger nftBalance) {}
}
