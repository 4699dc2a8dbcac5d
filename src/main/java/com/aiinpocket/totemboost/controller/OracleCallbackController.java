package com.aiinpocket.totemboost.controller;

import com.aiinpocket.totemboost.model.dto.FulfillRequest;
import com.aiinpocket.totemboost.model.dto.PremiumRewardResult;
import com.aiinpocket.totemboost.service.BoostSystem;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

/**
 * 隨機數預言機回呼端點。只接受設定中的預言機地址。
 */
@RestController
@RequestMapping("/api/v1/oracle")
@RequiredArgsConstructor
@Slf4j
public class OracleCallbackController {

    private final BoostSystem boostSystem;

    @PostMapping("/fulfill")
    public PremiumRewardResult fulfill(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody FulfillRequest body) {
        log.debug("[預言機] 收到回呼 requestId={} words={}", body.requestId(), body.randomWords().size());
        return boostSystem.fulfillRandomWords(jwt.getSubject(), body.requestId(), body.randomWords());
    }
}
