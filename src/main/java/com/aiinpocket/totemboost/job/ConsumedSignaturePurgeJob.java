package com.aiinpocket.totemboost.job;

import com.aiinpocket.totemboost.service.DistributedLockService;
import com.aiinpocket.totemboost.service.SignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 已消耗簽章清理排程（每 10 分鐘）。
 * 簽章時間超出容許範圍的紀錄可以安全刪除：同一簽章重送時會先被判定為過期。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsumedSignaturePurgeJob extends QuartzJobBean {

    private final SignatureVerifier signatureVerifier;
    private final DistributedLockService lockService;

    /** Advisory lock ID: ConsumedSignaturePurgeJob 專用 */
    private static final long PURGE_LOCK_ID = 3_000_001L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        // 例外在鎖的交易外攔截，內層失敗時交易照常回滾
        try {
            lockService.executeWithLock(PURGE_LOCK_ID, "ConsumedSignaturePurgeJob", () -> {
                int deleted = signatureVerifier.purgeExpired();
                if (deleted > 0) {
                    log.info("[簽章清理] 刪除 {} 筆過期的已消耗簽章", deleted);
                }
            });
        } catch (Exception e) {
            log.error("[簽章清理] 執行失敗: {}", e.getMessage(), e);
        }
    }
}
