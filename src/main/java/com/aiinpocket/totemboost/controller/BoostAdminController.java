package com.aiinpocket.totemboost.controller;

import com.aiinpocket.totemboost.model.dto.BoostSettingsSnapshot;
import com.aiinpocket.totemboost.service.BoostSettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;

/**
 * 加持系統管理 API。權限檢查在 BoostSettingsService 內由 BoostAuthorizationPolicy 執行。
 */
@RestController
@RequestMapping("/api/v1/boost/admin")
@RequiredArgsConstructor
public class BoostAdminController {

    private final BoostSettingsService settingsService;

    @PutMapping("/reward-points")
    public BoostSettingsSnapshot setBoostRewardPoints(@AuthenticationPrincipal Jwt jwt,
                                                      @RequestBody Map<String, Long> body) {
        return settingsService.setBoostRewardPoints(jwt.getSubject(), required(body, "points"));
    }

    @PutMapping("/premium-price")
    public BoostSettingsSnapshot setPremiumBoostPrice(@AuthenticationPrincipal Jwt jwt,
                                                      @RequestBody Map<String, String> body) {
        return settingsService.setPremiumBoostPrice(jwt.getSubject(), new BigInteger(required(body, "price")));
    }

    @PutMapping("/cooldown")
    public BoostSettingsSnapshot setFreeBoostCooldown(@AuthenticationPrincipal Jwt jwt,
                                                      @RequestBody Map<String, Long> body) {
        return settingsService.setFreeBoostCooldown(jwt.getSubject(),
                Duration.ofSeconds(required(body, "cooldownSeconds")));
    }

    @PutMapping("/frontend-signer")
    public BoostSettingsSnapshot setFrontendSigner(@AuthenticationPrincipal Jwt jwt,
                                                   @RequestBody Map<String, String> body) {
        return settingsService.setFrontendSigner(jwt.getSubject(), required(body, "publicKey"));
    }

    @PutMapping("/badge-nft")
    public BoostSettingsSnapshot setBadgeNft(@AuthenticationPrincipal Jwt jwt,
                                             @RequestBody Map<String, String> body) {
        return settingsService.setBadgeNft(jwt.getSubject(), required(body, "address"));
    }

    @PostMapping("/pause")
    public ResponseEntity<BoostSettingsSnapshot> pause(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(settingsService.pause(jwt.getSubject()));
    }

    @PostMapping("/unpause")
    public ResponseEntity<BoostSettingsSnapshot> unpause(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(settingsService.unpause(jwt.getSubject()));
    }

    private static <T> T required(Map<String, T> body, String field) {
        T value = body.get(field);
        if (value == null) {
            throw new IllegalArgumentException("缺少欄位: " + field);
        }
        return value;
    }
}
