package com.zonewatch.schedule;

import com.zonewatch.entity.AlertSettings;
import com.zonewatch.service.ReconcilerService;
import com.zonewatch.service.SettingsChangedEvent;
import com.zonewatch.service.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/**
 * 동기화 / 전체 재점검 크론 작업을 등록합니다.
 * - 크론 식과 사용 여부는 저장된 알림 설정(syncSchedule, scanSchedule)을 따릅니다.
 * - 설정이 저장되면 기존 작업을 취소하고 다시 등록합니다.
 * - 5필드 크론 식은 초 필드 "0" 을 붙여 사용합니다.
 */
@Slf4j
@Component
public class ZonewatchScheduler {

    private final TaskScheduler taskScheduler;
    private final ReconcilerService reconciler;
    private final SettingsService settingsService;

    private ScheduledFuture<?> syncJob;
    private ScheduledFuture<?> scanJob;

    public ZonewatchScheduler(TaskScheduler zonewatchTaskScheduler, ReconcilerService reconciler,
                              SettingsService settingsService) {
        this.taskScheduler = zonewatchTaskScheduler;
        this.reconciler = reconciler;
        this.settingsService = settingsService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        reschedule(settingsService.reload());
    }

    @EventListener
    public void onSettingsChanged(SettingsChangedEvent event) {
        reschedule(event.getSettings());
    }

    synchronized void reschedule(AlertSettings settings) {
        // 1) 기존 작업 취소 (실행 중인 작업은 끝까지 돈다)
        cancel(syncJob);
        cancel(scanJob);
        syncJob = null;
        scanJob = null;

        // 2) 켜져 있고 식이 올바를 때만 등록
        if (settings.isSyncOn()) {
            syncJob = register("sync", settings.getSyncSchedule(), this::runSync);
        }
        if (settings.isScanOn()) {
            scanJob = register("scan", settings.getScanSchedule(), this::runScan);
        }
    }

    boolean isSyncScheduled() {
        return syncJob != null;
    }

    boolean isScanScheduled() {
        return scanJob != null;
    }

    private ScheduledFuture<?> register(String name, String expression, Runnable job) {
        if (!CronSchedules.isValid(expression)) {
            log.warn("{} 크론 식이 없거나 올바르지 않아 등록하지 않습니다: {}", name, expression);
            return null;
        }
        String cron = CronSchedules.normalize(expression);
        log.info("{} 크론 등록: {}", name, cron);
        return taskScheduler.schedule(job, new CronTrigger(cron));
    }

    private void runSync() {
        var result = reconciler.performSync();
        if (!result.success()) {
            log.warn("예약 동기화 실패: {}", result.error());
        }
    }

    private void runScan() {
        var result = reconciler.performScan();
        if (!result.success()) {
            log.warn("예약 재점검 실패: {}", result.error());
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
