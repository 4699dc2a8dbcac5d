package com.aiinpocket.totemboost.controller;

import com.aiinpocket.totemboost.model.dto.BadgeAvailability;
import com.aiinpocket.totemboost.model.dto.BadgeMintResult;
import com.aiinpocket.totemboost.model.dto.BoostData;
import com.aiinpocket.totemboost.model.dto.BoostHistoryEntry;
import com.aiinpocket.totemboost.model.dto.BoostRequest;
import com.aiinpocket.totemboost.model.dto.BoostResult;
import com.aiinpocket.totemboost.model.dto.PendingPremiumBoost;
import com.aiinpocket.totemboost.model.dto.PremiumBoostConfig;
import com.aiinpocket.totemboost.model.dto.PremiumBoostReceipt;
import com.aiinpocket.totemboost.model.dto.PremiumBoostRequest;
import com.aiinpocket.totemboost.model.dto.StreakInfo;
import com.aiinpocket.totemboost.service.BoostSystem;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 加持 API（v1）。呼叫者身分取自 JWT subject（錢包地址）。
 * 查詢類端點可帶 user 參數查看其他地址，未帶時查自己。
 */
@RestController
@RequestMapping("/api/v1/boost")
@RequiredArgsConstructor
public class BoostController {

    private final BoostSystem boostSystem;

    @PostMapping("/{totem}")
    public BoostResult boost(@AuthenticationPrincipal Jwt jwt,
                             @PathVariable String totem,
                             @Valid @RequestBody BoostRequest body) {
        return boostSystem.boost(jwt.getSubject(), totem, body.timestamp(), body.signature());
    }

    @PostMapping("/{totem}/premium")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public PremiumBoostReceipt premiumBoost(@AuthenticationPrincipal Jwt jwt,
                                            @PathVariable String totem,
                                            @Valid @RequestBody PremiumBoostRequest body) {
        return boostSystem.premiumBoost(jwt.getSubject(), totem, body.payment());
    }

    @PostMapping("/badges/{milestone}/mint")
    public BadgeMintResult mintBadge(@AuthenticationPrincipal Jwt jwt, @PathVariable int milestone) {
        return boostSystem.mintBadge(jwt.getSubject(), milestone);
    }

    @GetMapping("/{totem}/streak")
    public StreakInfo getStreakInfo(@AuthenticationPrincipal Jwt jwt,
                                    @PathVariable String totem,
                                    @RequestParam(required = false) String user) {
        return boostSystem.getStreakInfo(userOrSelf(jwt, user), totem);
    }

    @GetMapping("/{totem}")
    public BoostData getBoostData(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable String totem,
                                  @RequestParam(required = false) String user) {
        return boostSystem.getBoostData(userOrSelf(jwt, user), totem);
    }

    @GetMapping("/badges/{milestone}")
    public Map<String, Integer> getAvailableBadges(@AuthenticationPrincipal Jwt jwt,
                                                   @PathVariable int milestone,
                                                   @RequestParam(required = false) String user) {
        return Map.of("milestone", milestone,
                "available", boostSystem.getAvailableBadges(userOrSelf(jwt, user), milestone));
    }

    @GetMapping("/badges")
    public List<BadgeAvailability> getAllAvailableBadges(@AuthenticationPrincipal Jwt jwt,
                                                         @RequestParam(required = false) String user) {
        return boostSystem.getAvailableBadges(userOrSelf(jwt, user));
    }

    @GetMapping("/premium/config")
    public PremiumBoostConfig getPremiumBoostConfig() {
        return boostSystem.getPremiumBoostConfig();
    }

    @GetMapping("/premium/pending")
    public List<PendingPremiumBoost> getPendingPremiumBoosts(@AuthenticationPrincipal Jwt jwt) {
        return boostSystem.getPendingPremiumBoosts(jwt.getSubject());
    }

    @GetMapping("/cooldown")
    public Map<String, Long> getFreeBoostCooldown() {
        return Map.of("cooldownSeconds", boostSystem.getFreeBoostCooldown().getSeconds());
    }

    @GetMapping("/history")
    public List<BoostHistoryEntry> getBoostHistory(@AuthenticationPrincipal Jwt jwt,
                                                   @RequestParam(defaultValue = "20") int limit) {
        return boostSystem.getBoostHistory(jwt.getSubject(), limit);
    }

    private static String userOrSelf(Jwt jwt, String user) {
        return user == null || user.isBlank() ? jwt.getSubject() : user;
    }
}
