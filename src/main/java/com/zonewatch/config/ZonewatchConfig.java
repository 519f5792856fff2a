package com.zonewatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class ZonewatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** 동기화/재점검 크론 작업 전용 스케줄러 */
    @Bean
    public ThreadPoolTaskScheduler zonewatchTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("zonewatch-cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /** API 로 요청한 동기화/재점검을 요청 스레드 밖에서 돌린다 (종류별 중복은 RunCoordinator 가 막음) */
    @Bean
    public ThreadPoolTaskExecutor zonewatchJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("zonewatch-job-");
        return executor;
    }
}
