package com.aiinpocket.totemboost.config;

import com.aiinpocket.totemboost.service.BoostSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 啟動時確保加持設定列存在。
 * 已存在時不覆寫，管理員在執行期調整過的值優先於設定檔。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoostSettingsInitializer {

    private final BoostSettingsService settingsService;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureSettings() {
        if (settingsService.ensureSettings()) {
            log.info("[設定] 已依設定檔初始化加持設定");
        } else {
            log.debug("[設定] 加持設定已存在，沿用資料庫中的值");
        }
    }
}
