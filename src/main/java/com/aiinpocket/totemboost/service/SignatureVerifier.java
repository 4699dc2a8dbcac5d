package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.entity.ConsumedSignature;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.repository.ConsumedSignatureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;

/**
 * 免費加持簽章驗證。
 *
 * <p>前端在使用者按下加持時，以前端簽章者私鑰對 {@code "<user>:<totem>:<timestamp>"} 簽章
 * （SHA256withECDSA / secp256r1，Base64 DER），後端以設定中的公鑰驗證：
 * <ul>
 *   <li>簽章不是由前端簽章者產生 → INVALID_SIGNATURE</li>
 *   <li>時間戳與現在相差超過容許範圍（預設 ±5 分鐘）→ SIGNATURE_EXPIRED</li>
 *   <li>同一訊息已被使用 → SIGNATURE_ALREADY_USED</li>
 * </ul>
 * 通過後將訊息摘要寫入 consumed_signature，之後同一訊息永遠無法再使用。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignatureVerifier {

    static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    private static final String KEY_ALGORITHM = "EC";

    private final ConsumedSignatureRepository consumedRepo;
    private final BoostSettingsService settingsService;
    private final BoostProperties props;
    private final Clock clock;

    /**
     * 驗證並消耗一個加持簽章。
     *
     * @param user      已正規化的使用者地址
     * @param totem     已正規化的圖騰地址
     * @param timestamp 簽章時間（epoch 秒）
     * @param signature Base64 DER 簽章
     */
    @Transactional
    public void verify(String user, String totem, long timestamp, String signature) {
        byte[] message = message(user, totem, timestamp);

        if (!isSignedByFrontend(message, signature)) {
            log.warn("[簽章] 簽章驗證失敗 user={} totem={} ts={}", user, totem, timestamp);
            throw new BoostException(BoostError.INVALID_SIGNATURE);
        }

        Instant now = clock.instant();
        Instant signedAt = Instant.ofEpochSecond(timestamp);
        if (Duration.between(signedAt, now).abs().compareTo(props.signatureTolerance()) > 0) {
            log.warn("[簽章] 簽章已過期 user={} ts={} now={}", user, signedAt, now);
            throw new BoostException(BoostError.SIGNATURE_EXPIRED);
        }

        String digest = digest(message);
        if (consumedRepo.existsById(digest)) {
            log.warn("[簽章] 重複使用的簽章 user={} totem={} ts={}", user, totem, timestamp);
            throw new BoostException(BoostError.SIGNATURE_ALREADY_USED);
        }

        // 立即 flush：並行請求同時通過 existsById 時，由主鍵衝突擋下第二筆
        try {
            consumedRepo.saveAndFlush(ConsumedSignature.builder()
                    .messageDigest(digest)
                    .userAddress(user)
                    .totemAddress(totem)
                    .signedAt(signedAt)
                    .consumedAt(now)
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.warn("[簽章] 並行請求重複使用簽章 user={} totem={} ts={}", user, totem, timestamp);
            throw new BoostException(BoostError.SIGNATURE_ALREADY_USED, "簽章已被使用", e);
        }
    }

    /**
     * 刪除已超出容許時間的消耗紀錄。這些簽章就算重送也會先被判定為過期。
     *
     * @return 刪除筆數
     */
    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(props.signatureTolerance());
        return consumedRepo.deleteSignedBefore(cutoff);
    }

    /**
     * 簽章訊息：{@code "<user>:<totem>:<timestamp>"} 的 UTF-8 bytes。
     */
    public static byte[] message(String user, String totem, long timestamp) {
        return (user + ":" + totem + ":" + timestamp).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 解析 Base64 X.509 EC 公鑰。
     *
     * @throws IllegalArgumentException 格式不正確
     */
    public static PublicKey decodePublicKey(String publicKeyBase64) {
        if (publicKeyBase64 == null || publicKeyBase64.isBlank()) {
            throw new IllegalArgumentException("公鑰為空");
        }
        try {
            byte[] keyBytes = Base64.getDecoder().decode(publicKeyBase64.trim());
            return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(keyBytes));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("無法解析 EC 公鑰", e);
        }
    }

    private boolean isSignedByFrontend(byte[] message, String signatureBase64) {
        String signerKey = settingsService.current().frontendSignerKey();
        if (signerKey == null || signerKey.isBlank()) {
            log.error("[簽章] 尚未設定前端簽章者公鑰，所有免費加持都會被拒絕");
            return false;
        }
        if (signatureBase64 == null || signatureBase64.isBlank()) {
            return false;
        }
        try {
            byte[] signatureBytes = Base64.getDecoder().decode(signatureBase64.trim());
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(decodePublicKey(signerKey));
            verifier.update(message);
            return verifier.verify(signatureBytes);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            // Base64 解碼失敗、DER 結構錯誤等，都視為簽章無效
            log.debug("[簽章] 無法驗證簽章: {}", e.getMessage());
            return false;
        }
    }

    private static String digest(byte[] message) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(message));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
