package com.zonewatch.service.impl;

import com.zonewatch.entity.AlertSettings;
import com.zonewatch.entity.EventType;
import com.zonewatch.notify.TemplateRenderException;
import com.zonewatch.notify.TemplateRenderer;
import com.zonewatch.repository.SettingsRepository;
import com.zonewatch.schedule.CronSchedules;
import com.zonewatch.service.SettingsChangedEvent;
import com.zonewatch.service.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Slf4j
@Service("SettingsService")
public class SettingsServiceImpl implements SettingsService {

    private final SettingsRepository settingsRepository;
    private final TemplateRenderer renderer;
    private final ApplicationEventPublisher publisher;

    private volatile AlertSettings snapshot;

    public SettingsServiceImpl(SettingsRepository settingsRepository, TemplateRenderer renderer,
                               ApplicationEventPublisher publisher) {
        this.settingsRepository = settingsRepository;
        this.renderer = renderer;
        this.publisher = publisher;
        this.snapshot = settingsRepository.get();
    }

    @Override
    public AlertSettings current() {
        return snapshot;
    }

    @Override
    public AlertSettings reload() {
        snapshot = settingsRepository.get();
        return snapshot;
    }

    @Override
    public AlertSettings stored() {
        return settingsRepository.get();
    }

    @Override
    public AlertSettings save(AlertSettings patch) {
        // 1) 템플릿 검증
        for (EventType type : EventType.values()) {
            String template = patch.templateFor(type);
            if (template == null || template.isBlank()) continue;
            try {
                renderer.validate(type, template);
            } catch (TemplateRenderException e) {
                throw new IllegalArgumentException(type + " 템플릿 오류: " + e.getMessage(), e);
            }
        }

        // 2) 크론 식 검증
        checkCron("syncSchedule", patch.getSyncSchedule());
        checkCron("scanSchedule", patch.getScanSchedule());

        // 3) 저장 후 스케줄러에 알림 (스냅샷은 다음 reload 에서 교체)
        AlertSettings saved = settingsRepository.save(patch);
        log.info("알림 설정 저장: {}", saved);
        publisher.publishEvent(new SettingsChangedEvent(this, saved));
        return saved;
    }

    private static void checkCron(String field, String expression) {
        if (expression == null || expression.isBlank()) return;
        if (!CronSchedules.isValid(expression)) {
            throw new IllegalArgumentException(field + " 크론 식이 올바르지 않습니다: " + expression);
        }
    }
}
