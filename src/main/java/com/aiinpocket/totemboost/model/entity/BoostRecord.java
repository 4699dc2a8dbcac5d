package com.aiinpocket.totemboost.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 使用者對單一圖騰的加持紀錄。
 * 第一次加持時建立，之後永不刪除；連續天數重置只會清空計數，不會刪除紀錄。
 */
@Entity
@Table(name = "boost_record", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"user_address", "totem_address"})
}, indexes = {
        @Index(name = "idx_boost_record_user", columnList = "user_address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    @Column(name = "totem_address", nullable = false, length = 42)
    private String totemAddress;

    /** 上次免費加持時間（冷卻判斷用） */
    @Column(name = "last_free_boost_at")
    private Instant lastFreeBoostAt;

    /** 上次高級加持時間（高級加持寬限日每個冷卻窗口只給一次） */
    @Column(name = "last_premium_boost_at")
    private Instant lastPremiumBoostAt;

    /** 目前連續窗口的起點，每次延續只前進整數個冷卻時間 */
    @Column(name = "streak_anchor_at")
    private Instant streakAnchorAt;

    @Column(name = "streak_length", nullable = false)
    @Builder.Default
    private int streakLength = 0;

    @Column(name = "grace_days_earned", nullable = false)
    @Builder.Default
    private int graceDaysEarned = 0;

    /** 已使用的寬限日，永遠不超過 graceDaysEarned */
    @Column(name = "grace_days_used", nullable = false)
    @Builder.Default
    private int graceDaysUsed = 0;

    /** 里程碑天數 → 尚未鑄造的徽章數 */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "boost_record_badge", joinColumns = @JoinColumn(name = "boost_record_id"))
    @MapKeyColumn(name = "milestone_days")
    @Column(name = "unminted_count", nullable = false)
    @Builder.Default
    private Map<Integer, Integer> unmintedBadges = new HashMap<>();

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public int getGraceDaysAvailable() {
        return graceDaysEarned - graceDaysUsed;
    }

    public int unmintedCount(int milestoneDays) {
        return unmintedBadges.getOrDefault(milestoneDays, 0);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
