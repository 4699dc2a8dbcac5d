package com.aiinpocket.totemboost.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 已使用過的加持簽章。主鍵為 (user, totem, timestamp) 訊息的 SHA-256，
 * 同一訊息第二次寫入會被主鍵擋下。
 */
@Entity
@Table(name = "consumed_signature", indexes = {
        @Index(name = "idx_consumed_signed_at", columnList = "signed_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsumedSignature {

    @Id
    @Column(name = "message_digest", length = 64)
    private String messageDigest;

    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    @Column(name = "totem_address", nullable = false, length = 42)
    private String totemAddress;

    /** 簽章內的時間戳 */
    @Column(name = "signed_at", nullable = false)
    private Instant signedAt;

    @Column(name = "consumed_at", nullable = false)
    private Instant consumedAt;
}
