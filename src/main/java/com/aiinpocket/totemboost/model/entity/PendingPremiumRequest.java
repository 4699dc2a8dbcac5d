package com.aiinpocket.totemboost.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 等待預言機回呼的高級加持請求。
 * streakSnapshot 是請求當下的連續天數，回呼時以此計算獎勵；回呼完成後刪除。
 */
@Entity
@Table(name = "pending_premium_request", indexes = {
        @Index(name = "idx_pending_user", columnList = "user_address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingPremiumRequest {

    /** 預言機回傳的請求 ID */
    @Id
    @Column(name = "request_id", length = 100)
    private String requestId;

    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    @Column(name = "totem_address", nullable = false, length = 42)
    private String totemAddress;

    @Column(name = "streak_snapshot", nullable = false)
    private int streakSnapshot;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;
}
