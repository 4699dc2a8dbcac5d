package com.aiinpocket.totemboost.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "boost_event_log", indexes = {
        @Index(name = "idx_boost_event_user", columnList = "user_address, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoostEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    @Column(name = "totem_address", length = 42)
    private String totemAddress;

    @Column(name = "event_type", nullable = false, length = 30)
    private String eventType;

    @Column(name = "event_data", length = 500)
    private String eventData;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
