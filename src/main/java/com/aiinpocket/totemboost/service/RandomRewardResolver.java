package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.dto.PendingPremiumBoost;
import com.aiinpocket.totemboost.model.dto.PremiumBoostReceipt;
import com.aiinpocket.totemboost.model.dto.PremiumRewardResult;
import com.aiinpocket.totemboost.model.entity.PendingPremiumRequest;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.model.enums.PremiumRewardTier;
import com.aiinpocket.totemboost.repository.PendingPremiumRequestRepository;
import com.aiinpocket.totemboost.service.client.MeritManagerClient;
import com.aiinpocket.totemboost.service.client.PaymentGatewayClient;
import com.aiinpocket.totemboost.service.client.RandomnessOracleClient;
import com.aiinpocket.totemboost.service.client.TreasuryClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 高級加持的兩段式隨機獎勵。
 *
 * <p>第一段（{@link #requestReward}）：向預言機請求 1 個隨機數，將 (user, totem, 連續天數快照)
 * 記在 requestId 底下，之後才把價格轉入金庫並退回超額，此時不入帳任何點數。
 * <p>第二段（{@link #fulfill}）：預言機回呼，以隨機數 mod 100 對照累積機率表決定等級，
 * 用請求當下的連續天數快照計算獎勵並入帳，刪除待處理紀錄。
 *
 * <p>預言機若永遠不回呼，待處理紀錄會一直保留；由 PendingPremiumWatchJob 定期回報。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RandomRewardResolver {

    static final int RANDOM_WORDS_PER_REQUEST = 1;

    private final PendingPremiumRequestRepository pendingRepo;
    private final RandomnessOracleClient oracleClient;
    private final TreasuryClient treasuryClient;
    private final PaymentGatewayClient paymentGateway;
    private final MeritManagerClient meritManager;
    private final RewardCalculator rewardCalculator;
    private final Clock clock;

    /**
     * 收款並送出隨機數請求。
     *
     * @param streakSnapshot 本次高級加持推進後的連續天數
     * @throws BoostException INSUFFICIENT_PAYMENT 若付款少於價格
     */
    @Transactional
    public PremiumBoostReceipt requestReward(String user, String totem, int streakSnapshot,
                                             boolean graceDayGranted, BigInteger payment, BigInteger price) {
        requirePayment(payment, price);

        // 先取得 requestId 並落地待處理紀錄，預言機失敗時尚未動到任何款項
        String requestId = oracleClient.request(RANDOM_WORDS_PER_REQUEST);
        pendingRepo.saveAndFlush(PendingPremiumRequest.builder()
                .requestId(requestId)
                .userAddress(user)
                .totemAddress(totem)
                .streakSnapshot(streakSnapshot)
                .requestedAt(clock.instant())
                .build());

        treasuryClient.receive(price);
        BigInteger excess = payment.subtract(price);
        if (excess.signum() > 0) {
            paymentGateway.refund(user, excess);
        }

        log.info("[高級加持] 用戶 {} 對圖騰 {} 送出隨機數請求 requestId={}（連續 {} 天，退款 {}）",
                user, totem, requestId, streakSnapshot, excess);
        return new PremiumBoostReceipt(requestId, totem, streakSnapshot, graceDayGranted, price, excess);
    }

    /**
     * @throws BoostException INSUFFICIENT_PAYMENT 若付款少於價格
     */
    public static void requirePayment(BigInteger payment, BigInteger price) {
        if (payment == null || payment.compareTo(price) < 0) {
            throw new BoostException(BoostError.INSUFFICIENT_PAYMENT,
                    String.format("付款金額不足！需要 %s，實付 %s", price, payment));
        }
    }

    /**
     * 預言機回呼：決定獎勵等級並入帳。
     *
     * @throws BoostException PREMIUM_REQUEST_NOT_FOUND 若 requestId 不存在或已處理
     */
    @Transactional
    public PremiumRewardResult fulfill(String requestId, List<BigInteger> randomWords) {
        if (randomWords == null || randomWords.isEmpty() || randomWords.get(0) == null) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "隨機數不可為空");
        }
        PendingPremiumRequest pending = pendingRepo.findById(requestId)
                .orElseThrow(() -> new BoostException(BoostError.PREMIUM_REQUEST_NOT_FOUND,
                        "找不到高級加持請求: " + requestId));

        PremiumRewardTier tier = PremiumRewardTier.fromRandomWord(randomWords.get(0));
        long reward = rewardCalculator.premiumReward(tier, pending.getStreakSnapshot());

        meritManager.creditMerit(pending.getTotemAddress(), reward);
        pendingRepo.delete(pending);

        log.info("[高級加持] requestId={} 開獎：{} → 圖騰 {} 入帳 {} 點（用戶 {}，連續 {} 天）",
                requestId, tier, pending.getTotemAddress(), reward,
                pending.getUserAddress(), pending.getStreakSnapshot());
        return new PremiumRewardResult(requestId, pending.getUserAddress(), pending.getTotemAddress(), tier, reward);
    }

    @Transactional(readOnly = true)
    public List<PendingPremiumBoost> listPending(String user) {
        return pendingRepo.findByUserAddressOrderByRequestedAtAsc(user).stream()
                .map(p -> new PendingPremiumBoost(
                        p.getRequestId(), p.getTotemAddress(), p.getStreakSnapshot(), p.getRequestedAt().toString()))
                .toList();
    }

    /**
     * 超過指定時間仍未回呼的請求。
     */
    @Transactional(readOnly = true)
    public List<PendingPremiumRequest> findStale(Instant cutoff) {
        return pendingRepo.findByRequestedAtBeforeOrderByRequestedAtAsc(cutoff);
    }
}
