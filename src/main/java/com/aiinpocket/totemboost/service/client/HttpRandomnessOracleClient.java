package com.aiinpocket.totemboost.service.client;

import com.aiinpocket.totemboost.config.ExternalServiceProperties;
import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.enums.BoostError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class HttpRandomnessOracleClient implements RandomnessOracleClient {

    private final RestClient randomnessOracleRestClient;
    private final ExternalServiceProperties props;

    @Override
    public String request(int numWords) {
        OracleRequestResponse response = ExternalCalls.call("RandomnessOracle", () -> randomnessOracleRestClient.post()
                .uri("/requests")
                .header("Content-Type", "application/json")
                .body(Map.of("numWords", numWords, "callbackUrl", props.oracleCallbackUrl()))
                .retrieve()
                .body(OracleRequestResponse.class));
        if (response == null || response.requestId() == null || response.requestId().isBlank()) {
            throw new BoostException(BoostError.EXTERNAL_SERVICE_UNAVAILABLE, "預言機未回傳請求 ID");
        }
        log.debug("[預言機] 已送出隨機數請求 requestId={}", response.requestId());
        return response.requestId();
    }

    record OracleRequestResponse(String requestId) {}
}
