package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.dto.BadgeAvailability;
import com.aiinpocket.totemboost.model.dto.BadgeMintResult;
import com.aiinpocket.totemboost.model.dto.BoostData;
import com.aiinpocket.totemboost.model.dto.BoostHistoryEntry;
import com.aiinpocket.totemboost.model.dto.BoostResult;
import com.aiinpocket.totemboost.model.dto.BoostSettingsSnapshot;
import com.aiinpocket.totemboost.model.dto.PendingPremiumBoost;
import com.aiinpocket.totemboost.model.dto.PremiumBoostConfig;
import com.aiinpocket.totemboost.model.dto.PremiumBoostReceipt;
import com.aiinpocket.totemboost.model.dto.PremiumRewardResult;
import com.aiinpocket.totemboost.model.dto.StreakAdvance;
import com.aiinpocket.totemboost.model.dto.StreakInfo;
import com.aiinpocket.totemboost.model.entity.BoostRecord;
import com.aiinpocket.totemboost.model.enums.BadgeMilestone;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.model.enums.PremiumRewardTier;
import com.aiinpocket.totemboost.repository.BoostRecordRepository;
import com.aiinpocket.totemboost.repository.PendingPremiumRequestRepository;
import com.aiinpocket.totemboost.security.BoostAuthorizationPolicy;
import com.aiinpocket.totemboost.service.client.MeritManagerClient;
import com.aiinpocket.totemboost.service.client.TotemHoldingClient;
import com.aiinpocket.totemboost.service.client.TotemHoldingClient.TotemHolding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 圖騰加持系統入口。
 *
 * <p>每個 (user, totem) 一筆 BoostRecord，狀態為
 * 未初始化 → 連續 n 天 →（連續 n+1 天 | 中斷後回到連續 1 天），沒有終止狀態。
 *
 * <p>所有寫入入口都在單一交易內完成，任何檢查失敗都丟出 {@link BoostException} 並整筆回滾。
 * 系統暫停時寫入入口一律拒絕，查詢不受影響。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BoostSystem {

    private final BoostRecordRepository recordRepo;
    private final PendingPremiumRequestRepository pendingRepo;
    private final BoostSettingsService settingsService;
    private final SignatureVerifier signatureVerifier;
    private final StreakTracker streakTracker;
    private final RewardCalculator rewardCalculator;
    private final RandomRewardResolver randomRewardResolver;
    private final BadgeLedger badgeLedger;
    private final BoostEventRecorder eventRecorder;
    private final TotemHoldingClient holdingClient;
    private final MeritManagerClient meritManager;
    private final BoostAuthorizationPolicy authorizationPolicy;
    private final BoostProperties props;
    private final Clock clock;

    /**
     * 免費加持：驗證前端簽章、檢查冷卻、推進連續天數並入帳功德點數。
     */
    @Transactional
    public BoostResult boost(String caller, String totemAddress, long timestamp, String signature) {
        String user = Addresses.normalize(caller);
        String totem = Addresses.normalize(totemAddress);
        requireNotPaused();
        BoostSettingsSnapshot settings = settingsService.current();

        requireHolding(user, totem);
        signatureVerifier.verify(user, totem, timestamp, signature);

        Instant now = clock.instant();
        Duration cooldown = settings.freeBoostCooldown();
        BoostRecord record = loadOrNew(user, totem, now);
        if (record.getLastFreeBoostAt() != null
                && Duration.between(record.getLastFreeBoostAt(), now).compareTo(cooldown) < 0) {
            log.debug("[加持] 用戶 {} 對圖騰 {} 冷卻中，上次免費加持 {}", user, totem, record.getLastFreeBoostAt());
            throw new BoostException(BoostError.NOT_ENOUGH_TIME_PASSED_FOR_FREE_BOOST);
        }

        StreakAdvance advance = streakTracker.advance(record, now, false, cooldown);
        long reward = rewardCalculator.freeReward(settings.boostRewardPoints(), advance.streakLength());

        // 簽章與紀錄先落地，版本衝突或重複簽章在入帳前就失敗
        record.setLastFreeBoostAt(now);
        recordRepo.saveAndFlush(record);
        meritManager.creditMerit(totem, reward);

        recordStreakEvents(user, totem, advance);
        eventRecorder.record(user, totem, BoostEventRecorder.FREE_BOOST, Map.of(
                "streak", advance.streakLength(),
                "reward", reward,
                "graceDayGranted", advance.graceDayGranted()));

        log.info("[加持] 用戶 {} 加持圖騰 {}：連續 {} 天，獲得 {} 點{}",
                user, totem, advance.streakLength(), reward,
                advance.graceDayGranted() ? "，獲得寬限日" : "");

        return new BoostResult(totem, advance.streakLength(), advance.graceDayGranted(), advance.reset(), reward,
                advance.milestonesReached().stream().map(BadgeMilestone::getDays).toList());
    }

    /**
     * 高級加持：立即推進連續天數，付款後送出隨機數請求，獎勵待預言機回呼後入帳。
     */
    @Transactional
    public PremiumBoostReceipt premiumBoost(String caller, String totemAddress, BigInteger payment) {
        String user = Addresses.normalize(caller);
        String totem = Addresses.normalize(totemAddress);
        requireNotPaused();
        BoostSettingsSnapshot settings = settingsService.current();

        requireHolding(user, totem);
        RandomRewardResolver.requirePayment(payment, settings.premiumBoostPrice());

        Instant now = clock.instant();
        BoostRecord record = loadOrNew(user, totem, now);
        StreakAdvance advance = streakTracker.advance(record, now, true, settings.freeBoostCooldown());
        record.setLastPremiumBoostAt(now);
        recordRepo.saveAndFlush(record);

        PremiumBoostReceipt receipt = randomRewardResolver.requestReward(
                user, totem, advance.streakLength(), advance.graceDayGranted(), payment, settings.premiumBoostPrice());

        recordStreakEvents(user, totem, advance);
        eventRecorder.record(user, totem, BoostEventRecorder.PREMIUM_REQUEST, Map.of(
                "requestId", receipt.requestId(),
                "streak", advance.streakLength(),
                "price", settings.premiumBoostPrice().toString(),
                "refunded", receipt.refunded().toString()));
        return receipt;
    }

    /**
     * 預言機回呼。已付款的請求在系統暫停期間仍可開獎，避免請求永久懸置。
     */
    @Transactional
    public PremiumRewardResult fulfillRandomWords(String caller, String requestId, List<BigInteger> randomWords) {
        authorizationPolicy.requireOracle(caller);
        PremiumRewardResult result = randomRewardResolver.fulfill(requestId, randomWords);
        eventRecorder.record(result.user(), result.totem(), BoostEventRecorder.PREMIUM_REWARD, Map.of(
                "requestId", requestId,
                "tier", result.tier().name(),
                "reward", result.rewardPoints()));
        return result;
    }

    /**
     * 鑄造里程碑徽章。
     */
    @Transactional
    public BadgeMintResult mintBadge(String caller, int milestone) {
        String user = Addresses.normalize(caller);
        requireNotPaused();
        BoostSettingsSnapshot settings = settingsService.current();

        BadgeMintResult result = badgeLedger.mintBadge(user, milestone, settings.badgeNftAddress());
        eventRecorder.record(user, null, BoostEventRecorder.BADGE_MINT, Map.of(
                "milestone", milestone,
                "remaining", result.remaining()));
        return result;
    }

    // ===== 查詢 =====

    @Transactional(readOnly = true)
    public StreakInfo getStreakInfo(String userAddress, String totemAddress) {
        String user = Addresses.normalize(userAddress);
        String totem = Addresses.normalize(totemAddress);
        Duration cooldown = settingsService.current().freeBoostCooldown();
        Instant now = clock.instant();

        return recordRepo.findByUserAddressAndTotemAddress(user, totem)
                .map(r -> {
                    Instant nextFree = r.getLastFreeBoostAt() == null ? null : r.getLastFreeBoostAt().plus(cooldown);
                    return new StreakInfo(
                            totem,
                            r.getStreakLength(),
                            r.getStreakAnchorAt(),
                            r.getGraceDaysEarned(),
                            r.getGraceDaysUsed(),
                            r.getGraceDaysAvailable(),
                            streakTracker.isStreakAlive(r, now, cooldown),
                            nextFree != null && nextFree.isAfter(now) ? nextFree : null);
                })
                .orElseGet(() -> new StreakInfo(totem, 0, null, 0, 0, 0, false, null));
    }

    @Transactional(readOnly = true)
    public BoostData getBoostData(String userAddress, String totemAddress) {
        String user = Addresses.normalize(userAddress);
        String totem = Addresses.normalize(totemAddress);
        long pending = pendingRepo.countByUserAddressAndTotemAddress(user, totem);

        return recordRepo.findByUserAddressAndTotemAddress(user, totem)
                .map(r -> new BoostData(user, totem,
                        r.getLastFreeBoostAt(),
                        r.getLastPremiumBoostAt(),
                        r.getStreakAnchorAt(),
                        r.getStreakLength(),
                        r.getGraceDaysEarned(),
                        r.getGraceDaysUsed(),
                        Map.copyOf(r.getUnmintedBadges()),
                        pending))
                .orElseGet(() -> new BoostData(user, totem, null, null, null, 0, 0, 0, Map.of(), pending));
    }

    public int getAvailableBadges(String userAddress, int milestone) {
        return badgeLedger.available(Addresses.normalize(userAddress), milestone);
    }

    public List<BadgeAvailability> getAvailableBadges(String userAddress) {
        return badgeLedger.availableAll(Addresses.normalize(userAddress));
    }

    public PremiumBoostConfig getPremiumBoostConfig() {
        List<PremiumBoostConfig.TierInfo> tiers = Arrays.stream(PremiumRewardTier.values())
                .map(t -> new PremiumBoostConfig.TierInfo(t.name(), t.getBasePoints(), t.getChancePct()))
                .toList();
        return new PremiumBoostConfig(settingsService.current().premiumBoostPrice(), tiers);
    }

    public Duration getFreeBoostCooldown() {
        return settingsService.current().freeBoostCooldown();
    }

    public List<BoostHistoryEntry> getBoostHistory(String userAddress, int limit) {
        return eventRecorder.history(Addresses.normalize(userAddress), limit);
    }

    public List<PendingPremiumBoost> getPendingPremiumBoosts(String userAddress) {
        return randomRewardResolver.listPending(Addresses.normalize(userAddress));
    }

    // ===== 內部方法 =====

    // 暫停旗標不走快取，管理員暫停後下一筆請求立即生效
    private void requireNotPaused() {
        if (settingsService.isPaused()) {
            throw new BoostException(BoostError.PAUSED);
        }
    }

    private void requireHolding(String user, String totem) {
        TotemHolding holding = holdingClient.holdingOf(totem, user);
        BigInteger minBalance = props.minTotemBalance() != null ? props.minTotemBalance() : BigInteger.ONE;
        boolean enoughTokens = holding.tokenBalance().compareTo(minBalance) >= 0;
        boolean ownsNft = holding.nftBalance().signum() > 0;
        if (!enoughTokens && !ownsNft) {
            log.debug("[加持] 用戶 {} 持有圖騰 {} 不足：代幣 {}，NFT {}",
                    user, totem, holding.tokenBalance(), holding.nftBalance());
            throw new BoostException(BoostError.NOT_ENOUGH_TOKENS);
        }
    }

    private BoostRecord loadOrNew(String user, String totem, Instant now) {
        return recordRepo.findByUserAddressAndTotemAddress(user, totem)
                .orElseGet(() -> BoostRecord.builder()
                        .userAddress(user)
                        .totemAddress(totem)
                        .createdAt(now)
                        .build());
    }

    private void recordStreakEvents(String user, String totem, StreakAdvance advance) {
        if (advance.reset()) {
            eventRecorder.record(user, totem, BoostEventRecorder.STREAK_RESET, Map.of("streak", advance.streakLength()));
        }
    }
}
