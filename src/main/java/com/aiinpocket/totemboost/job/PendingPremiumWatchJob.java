package com.aiinpocket.totemboost.job;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.model.entity.PendingPremiumRequest;
import com.aiinpocket.totemboost.service.DistributedLockService;
import com.aiinpocket.totemboost.service.RandomRewardResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 未回呼高級加持請求的巡檢排程（每小時）。
 * 只記錄警告，不取消也不重送：請求已付款，是否補償由營運人工判斷。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingPremiumWatchJob extends QuartzJobBean {

    private final RandomRewardResolver randomRewardResolver;
    private final DistributedLockService lockService;
    private final BoostProperties props;
    private final Clock clock;

    /** Advisory lock ID: PendingPremiumWatchJob 專用 */
    private static final long WATCH_LOCK_ID = 3_000_002L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        try {
            lockService.executeWithLock(WATCH_LOCK_ID, "PendingPremiumWatchJob", () -> {
                List<PendingPremiumRequest> stale =
                        randomRewardResolver.findStale(clock.instant().minus(props.pendingRequestStaleAfter()));
                if (stale.isEmpty()) {
                    return;
                }
                log.warn("[高級加持巡檢] {} 筆請求超過 {} 仍未回呼", stale.size(), props.pendingRequestStaleAfter());
                stale.forEach(p -> log.warn("[高級加持巡檢] requestId={} user={} totem={} requestedAt={}",
                        p.getRequestId(), p.getUserAddress(), p.getTotemAddress(), p.getRequestedAt()));
            });
        } catch (Exception e) {
            log.error("[高級加持巡檢] 執行失敗: {}", e.getMessage(), e);
        }
    }
}
