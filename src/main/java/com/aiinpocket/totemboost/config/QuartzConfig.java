package com.aiinpocket.totemboost.config;

import com.aiinpocket.totemboost.job.ConsumedSignaturePurgeJob;
import com.aiinpocket.totemboost.job.PendingPremiumWatchJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // 已消耗簽章清理：每 10 分鐘
    @Bean
    public JobDetail signaturePurgeJobDetail() {
        return JobBuilder.newJob(ConsumedSignaturePurgeJob.class)
                .withIdentity("signaturePurgeJob", "boost")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger signaturePurgeTrigger(JobDetail signaturePurgeJobDetail) {
        return TriggerBuilder.newTrigger()
                .forJob(signaturePurgeJobDetail)
                .withIdentity("signaturePurgeTrigger", "boost")
                .withSchedule(CronScheduleBuilder.cronSchedule("0 */10 * * * ?"))
                .build();
    }

    // 未回呼高級加持巡檢：每小時第 5 分
    @Bean
    public JobDetail pendingPremiumWatchJobDetail() {
        return JobBuilder.newJob(PendingPremiumWatchJob.class)
                .withIdentity("pendingPremiumWatchJob", "boost")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger pendingPremiumWatchTrigger(JobDetail pendingPremiumWatchJobDetail) {
        return TriggerBuilder.newTrigger()
                .forJob(pendingPremiumWatchJobDetail)
                .withIdentity("pendingPremiumWatchTrigger", "boost")
                .withSchedule(CronScheduleBuilder.cronSchedule("0 5 * * * ?"))
                .build();
    }
}
