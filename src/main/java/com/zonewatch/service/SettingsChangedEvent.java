package com.zonewatch.service;

import com.zonewatch.entity.AlertSettings;
import org.springframework.context.ApplicationEvent;

/** 설정이 저장된 뒤 발행된다 (스케줄 재등록용) */
public class SettingsChangedEvent extends ApplicationEvent {

    private final AlertSettings settings;

    public SettingsChangedEvent(Object source, AlertSettings settings) {
        super(source);
        this.settings = settings;
    }

    public AlertSettings getSettings() {
        return settings;
    }
}
