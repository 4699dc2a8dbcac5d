package com.aiinpocket.totemboost.service.client;

import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.enums.BoostError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class HttpMeritManagerClient implements MeritManagerClient {

    private final RestClient meritManagerRestClient;

    @Override
    public void creditMerit(String totem, long amount) {
        ExternalCalls.run("MeritManager", () -> meritManagerRestClient.post()
                .uri("/totems/{totem}/merit", totem)
                .header("Content-Type", "application/json")
                .body(Map.of("amount", amount))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), (req, res) -> {
                    throw new BoostException(BoostError.TOTEM_NOT_REGISTERED, "圖騰尚未註冊: " + totem);
                })
                .toBodilessEntity());
        log.debug("[功德] 圖騰 {} 入帳 {} 點", totem, amount);
    }

    @Override
    public BoostPeriod currentBoostPeriod() {
        BoostPeriod period = ExternalCalls.call("MeritManager", () -> meritManagerRestClient.get()
                .uri("/boost-period")
                .retrieve()
                .body(BoostPeriod.class));
        return period != null ? period : BoostPeriod.INACTIVE;
    }
}
