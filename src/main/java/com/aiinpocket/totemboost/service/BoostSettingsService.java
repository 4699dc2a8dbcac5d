package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.config.CacheConfig;
import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.dto.BoostSettingsSnapshot;
import com.aiinpocket.totemboost.model.entity.BoostSettings;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.repository.BoostSettingsRepository;
import com.aiinpocket.totemboost.security.BoostAuthorizationPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * 加持設定服務。
 * 讀取走 Caffeine 快取的不可變快照；寫入需管理員權限，寫入後整批清除快取。
 *
 * <p>設定列不存在時以 {@link BoostProperties} 的值建立（啟動時由 BoostSettingsInitializer 觸發）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BoostSettingsService {

    private final BoostSettingsRepository settingsRepo;
    private final BoostProperties props;
    private final BoostAuthorizationPolicy authorizationPolicy;
    private final Clock clock;

    /**
     * 取得目前的設定快照。
     */
    @Cacheable(CacheConfig.BOOST_SETTINGS_CACHE)
    @Transactional
    public BoostSettingsSnapshot current() {
        return toSnapshot(loadOrCreate());
    }

    /**
     * 直接讀取暫停旗標，不經過快取。設定列尚未建立時視為未暫停。
     */
    @Transactional(readOnly = true)
    public boolean isPaused() {
        return settingsRepo.findById(BoostSettings.SINGLETON_ID)
                .map(BoostSettings::isPaused)
                .orElse(false);
    }

    /**
     * 確保設定列存在，回傳是否為新建立。
     */
    @Transactional
    public boolean ensureSettings() {
        if (settingsRepo.existsById(BoostSettings.SINGLETON_ID)) {
            return false;
        }
        loadOrCreate();
        return true;
    }

    // ===== 管理員操作 =====

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot setBoostRewardPoints(String caller, long points) {
        if (points <= 0) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "加持點數必須大於 0");
        }
        return update(caller, "boostRewardPoints", points, s -> s.setBoostRewardPoints(points));
    }

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot setPremiumBoostPrice(String caller, BigInteger price) {
        if (price == null || price.signum() <= 0) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "高級加持價格必須大於 0");
        }
        return update(caller, "premiumBoostPrice", price, s -> s.setPremiumBoostPrice(price));
    }

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot setFreeBoostCooldown(String caller, Duration cooldown) {
        if (cooldown == null || cooldown.getSeconds() <= 0) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "冷卻時間必須大於 0 秒");
        }
        return update(caller, "freeBoostCooldown", cooldown,
                s -> s.setFreeBoostCooldownSeconds(cooldown.getSeconds()));
    }

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot setFrontendSigner(String caller, String publicKeyBase64) {
        try {
            SignatureVerifier.decodePublicKey(publicKeyBase64);
        } catch (IllegalArgumentException e) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "前端簽章者公鑰格式不正確", e);
        }
        return update(caller, "frontendSigner", "(EC public key)", s -> s.setFrontendSignerKey(publicKeyBase64));
    }

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot setBadgeNft(String caller, String badgeNftAddress) {
        String normalized = Addresses.normalize(badgeNftAddress);
        return update(caller, "badgeNft", normalized, s -> s.setBadgeNftAddress(normalized));
    }

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot pause(String caller) {
        return update(caller, "paused", true, s -> s.setPaused(true));
    }

    @CacheEvict(cacheNames = CacheConfig.BOOST_SETTINGS_CACHE, allEntries = true)
    @Transactional
    public BoostSettingsSnapshot unpause(String caller) {
        return update(caller, "paused", false, s -> s.setPaused(false));
    }

    // ===== 內部方法 =====

    private BoostSettingsSnapshot update(String caller, String field, Object value, Consumer<BoostSettings> mutation) {
        authorizationPolicy.requireManager(caller);
        BoostSettings settings = loadOrCreate();
        mutation.accept(settings);
        settings.setUpdatedAt(clock.instant());
        settingsRepo.save(settings);
        log.info("[設定] 管理員 {} 更新 {} = {}", caller, field, value);
        return toSnapshot(settings);
    }

    private BoostSettings loadOrCreate() {
        return settingsRepo.findById(BoostSettings.SINGLETON_ID).orElseGet(() -> {
            BoostSettings created = BoostSettings.builder()
                    .id(BoostSettings.SINGLETON_ID)
                    .boostRewardPoints(props.boostRewardPoints())
                    .premiumBoostPrice(props.premiumBoostPrice())
                    .freeBoostCooldownSeconds(props.freeBoostCooldown().getSeconds())
                    .frontendSignerKey(props.frontendSignerKey())
                    .badgeNftAddress(Addresses.isValid(props.badgeNftAddress())
                            ? Addresses.normalize(props.badgeNftAddress()) : null)
                    .paused(false)
                    .updatedAt(clock.instant())
                    .build();
            log.info("[設定] 建立初始加持設定: 基礎點數={}, 高級加持價格={}, 冷卻={}",
                    created.getBoostRewardPoints(), created.getPremiumBoostPrice(), props.freeBoostCooldown());
            return settingsRepo.save(created);
        });
    }

    private static BoostSettingsSnapshot toSnapshot(BoostSettings s) {
        return new BoostSettingsSnapshot(
                s.getBoostRewardPoints(),
                s.getPremiumBoostPrice(),
                Duration.ofSeconds(s.getFreeBoostCooldownSeconds()),
                s.getFrontendSignerKey(),
                s.getBadgeNftAddress(),
                s.isPaused()
        );
    }
}
