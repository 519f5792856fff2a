package com.zonewatch.repository;

import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.AlertSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/** 프로퍼티(zonewatch.settings.*)로 초기화되는 메모리 설정 저장소 */
@Repository
public class InMemorySettingsRepository implements SettingsRepository {

    private AlertSettings current;

    @Autowired
    public InMemorySettingsRepository(ZonewatchProperties props) {
        this(props.getSettings());
    }

    public InMemorySettingsRepository(AlertSettings seed) {
        this.current = seed == null ? new AlertSettings() : seed.copy();
    }

    @Override
    public synchronized AlertSettings get() {
        return current.copy();
    }

    @Override
    public synchronized AlertSettings save(AlertSettings patch) {
        AlertSettings merged = current.copy();
        merged.mergeFrom(patch);
        current = merged;
        return merged.copy();
    }
}
