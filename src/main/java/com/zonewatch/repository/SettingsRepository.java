package com.zonewatch.repository;

import com.zonewatch.entity.AlertSettings;

public interface SettingsRepository {

    /** 현재 설정의 복사본 */
    AlertSettings get();

    /** patch 의 null 이 아닌 필드만 병합해 저장하고, 병합 결과를 돌려준다 */
    AlertSettings save(AlertSettings patch);
}
