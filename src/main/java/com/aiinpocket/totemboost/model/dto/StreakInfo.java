package com.aiinpocket.totemboost.model.dto;

import java.time.Instant;

/**
 * 連續天數查詢結果。
 *
 * @param streakAlive      以目前時間來看，下一次加持是否還能延續（含寬限日）
 * @param nextFreeBoostAt  下一次可免費加持的時間（null 表示現在就可以）
 */
public record StreakInfo(
        String totem,
        int streakLength,
        Instant streakAnchorAt,
        int graceDaysEarned,
        int graceDaysUsed,
        int graceDaysAvailable,
        boolean streakAlive,
        Instant nextFreeBoostAt
) {}
