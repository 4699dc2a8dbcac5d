package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.model.dto.StreakAdvance;
import com.aiinpocket.totemboost.model.entity.BoostRecord;
import com.aiinpocket.totemboost.model.enums.BadgeMilestone;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 連續加持狀態機。
 *
 * <p>以 streakAnchorAt 為起點、冷卻時間（預設 24h）為一個窗口：
 * <ul>
 *   <li>同一窗口內再次加持：連續天數不變</li>
 *   <li>下一個窗口加持：連續天數 +1，起點前進一個冷卻時間（不是移到現在，保持窗口對齊）</li>
 *   <li>跳過 N 個窗口：寬限日足夠則扣 N 天並延續，否則重置為 1、寬限日歸零、未鑄造徽章清空</li>
 * </ul>
 * 每滿 30 天（graceDayInterval）的倍數獲得 1 個寬限日；高級加持每個冷卻窗口最多獲得 1 個寬限日。
 * 達到里程碑天數時該里程碑可鑄造徽章 +1。
 *
 * <p>此類別只修改傳入的 BoostRecord，不負責儲存。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreakTracker {

    private final BoostProperties props;

    /**
     * 依加持時間推進連續天數。
     *
     * @param record    加持紀錄（會被原地修改）
     * @param now       加持時間
     * @param isPremium 是否為高級加持
     * @param cooldown  目前的冷卻時間
     */
    public StreakAdvance advance(BoostRecord record, Instant now, boolean isPremium, Duration cooldown) {
        int before = record.getStreakLength();
        int graceConsumed = 0;
        boolean reset = false;

        if (record.getStreakAnchorAt() == null || before == 0) {
            record.setStreakAnchorAt(now);
            record.setStreakLength(1);
        } else {
            Duration elapsed = Duration.between(record.getStreakAnchorAt(), now);
            // 同一窗口內（elapsed < cooldown）連續天數不變
            if (elapsed.compareTo(cooldown) >= 0 && elapsed.compareTo(cooldown.multipliedBy(2)) < 0) {
                record.setStreakLength(before + 1);
                record.setStreakAnchorAt(record.getStreakAnchorAt().plus(cooldown));
            } else if (elapsed.compareTo(cooldown.multipliedBy(2)) >= 0) {
                long missed = elapsed.dividedBy(cooldown) - 1;
                if (missed <= record.getGraceDaysAvailable()) {
                    graceConsumed = (int) missed;
                    record.setGraceDaysUsed(record.getGraceDaysUsed() + graceConsumed);
                    record.setStreakLength(before + 1);
                    record.setStreakAnchorAt(record.getStreakAnchorAt().plus(cooldown.multipliedBy(missed + 1)));
                    log.debug("[連續] {}/{} 使用 {} 個寬限日延續連續天數", record.getUserAddress(),
                            record.getTotemAddress(), graceConsumed);
                } else {
                    log.info("[連續] {}/{} 錯過 {} 個窗口且寬限日不足（剩 {}），連續天數由 {} 重置",
                            record.getUserAddress(), record.getTotemAddress(), missed,
                            record.getGraceDaysAvailable(), before);
                    resetStreak(record, now);
                    reset = true;
                }
            }
        }

        boolean graceGranted = false;
        List<BadgeMilestone> reached = new ArrayList<>();
        int after = record.getStreakLength();

        if (after != before || reset) {
            if (after % props.graceDayInterval() == 0) {
                record.setGraceDaysEarned(record.getGraceDaysEarned() + 1);
                graceGranted = true;
            }
            BadgeMilestone.ofDays(after).ifPresent(milestone -> {
                record.getUnmintedBadges().merge(milestone.getDays(), 1, Integer::sum);
                reached.add(milestone);
            });
        }

        if (isPremium && premiumGraceAvailable(record, now, cooldown)) {
            record.setGraceDaysEarned(record.getGraceDaysEarned() + 1);
            graceGranted = true;
        }

        return new StreakAdvance(after, graceGranted, graceConsumed, reset, List.copyOf(reached));
    }

    /**
     * 以目前時間判斷下一次加持能否延續連續天數（不修改紀錄）。
     */
    public boolean isStreakAlive(BoostRecord record, Instant now, Duration cooldown) {
        if (record.getStreakAnchorAt() == null || record.getStreakLength() == 0) {
            return false;
        }
        Duration elapsed = Duration.between(record.getStreakAnchorAt(), now);
        if (elapsed.compareTo(cooldown.multipliedBy(2)) < 0) {
            return true;
        }
        long missed = elapsed.dividedBy(cooldown) - 1;
        return missed <= record.getGraceDaysAvailable();
    }

    private static boolean premiumGraceAvailable(BoostRecord record, Instant now, Duration cooldown) {
        Instant last = record.getLastPremiumBoostAt();
        return last == null || Duration.between(last, now).compareTo(cooldown) >= 0;
    }

    private static void resetStreak(BoostRecord record, Instant now) {
        record.setStreakLength(1);
        record.setStreakAnchorAt(now);
        record.setGraceDaysEarned(0);
        record.setGraceDaysUsed(0);
        // 已鑄造的徽章 NFT 不受影響，只清空尚未鑄造的次數
        record.getUnmintedBadges().clear();
    }
}
