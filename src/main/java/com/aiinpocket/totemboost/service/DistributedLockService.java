package com.aiinpocket.totemboost.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 排程用的跨 Pod 互斥。
 *
 * <p>以 pg_try_advisory_xact_lock 在一個交易內取鎖並執行任務，交易結束時 PostgreSQL 自動釋放鎖。
 * 取鎖與任務綁在同一條連線上，不會發生「在連線池另一條連線上 unlock」的情況。
 */
@Service
@Slf4j
public class DistributedLockService {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public DistributedLockService(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * 取得鎖後執行任務；其他 Pod 持有同一個 lockId 時直接跳過。
     *
     * @return true 如果任務被執行
     */
    public boolean executeWithLock(long lockId, String taskName, Runnable task) {
        Boolean executed = transactionTemplate.execute(status -> {
            Boolean acquired = jdbcTemplate.queryForObject(
                    "SELECT pg_try_advisory_xact_lock(?)", Boolean.class, lockId);
            if (!Boolean.TRUE.equals(acquired)) {
                log.debug("[分散式鎖] {} 已被其他 Pod 處理，跳過 (lockId={})", taskName, lockId);
                return false;
            }
            task.run();
            return true;
        });
        return Boolean.TRUE.equals(executed);
    }
}
