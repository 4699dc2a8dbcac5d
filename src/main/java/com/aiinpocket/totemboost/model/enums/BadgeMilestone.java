package com.aiinpocket.totemboost.model.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 連續加持里程碑。連續天數達到門檻時，該里程碑的可鑄造徽章數 +1。
 * 重置後可再次達成。
 */
@Getter
public enum BadgeMilestone {

    WEEK(7, "七日信徒", "連續加持 7 天"),
    FORTNIGHT(14, "雙週守護者", "連續加持 14 天"),
    MONTH(30, "月光信徒", "連續加持 30 天"),
    TWO_MONTHS(60, "堅定之心", "連續加持 60 天"),
    HUNDRED(100, "百日征途", "連續加持 100 天"),
    HALF_YEAR(180, "半載不輟", "連續加持 180 天"),
    YEAR(365, "圖騰傳說", "連續加持 365 天");

    private final int days;
    private final String displayName;
    private final String description;

    BadgeMilestone(int days, String displayName, String description) {
        this.days = days;
        this.displayName = displayName;
        this.description = description;
    }

    public static Optional<BadgeMilestone> ofDays(int days) {
        return Arrays.stream(values()).filter(m -> m.days == days).findFirst();
    }
}
