package com.aiinpocket.totemboost.model.dto;

import com.aiinpocket.totemboost.model.enums.BadgeMilestone;

import java.util.List;

/**
 * 一次連續天數推進的結果。
 *
 * @param streakLength       推進後的連續天數
 * @param graceDayGranted    本次是否獲得寬限日（高級加持或滿 30 天倍數）
 * @param graceDaysConsumed  本次補足斷掉的窗口所用掉的寬限日
 * @param reset              是否因寬限日不足而重置
 * @param milestonesReached  本次達成的里程碑
 */
public record StreakAdvance(
        int streakLength,
        boolean graceDayGranted,
        int graceDaysConsumed,
        boolean reset,
        List<BadgeMilestone> milestonesReached
) {}
