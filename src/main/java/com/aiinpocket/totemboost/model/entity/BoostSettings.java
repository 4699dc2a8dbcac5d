package com.aiinpocket.totemboost.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 可由管理員調整的加持設定，整張表只有一列（id = 1）。
 */
@Entity
@Table(name = "boost_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoostSettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    /** 免費加持基礎點數 */
    @Column(name = "boost_reward_points", nullable = false)
    private Long boostRewardPoints;

    /** 高級加持價格（最小單位） */
    @Column(name = "premium_boost_price", nullable = false, precision = 78, scale = 0)
    private BigInteger premiumBoostPrice;

    @Column(name = "free_boost_cooldown_seconds", nullable = false)
    private Long freeBoostCooldownSeconds;

    /** 前端簽章者公鑰（Base64 X.509） */
    @Column(name = "frontend_signer_key", columnDefinition = "TEXT")
    private String frontendSignerKey;

    @Column(name = "badge_nft_address", length = 42)
    private String badgeNftAddress;

    @Column(nullable = false)
    @Builder.Default
    private boolean paused = false;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
