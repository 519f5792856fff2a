package com.zonewatch.service;

import com.zonewatch.entity.AlertSettings;

public interface SettingsService {

    /** 마지막으로 읽어 둔 설정 스냅샷 (실행 중인 작업은 이 값을 본다) */
    AlertSettings current();

    /** 저장소에서 다시 읽어 스냅샷을 교체한다. 동기화/재점검 시작 시점에만 부른다. */
    AlertSettings reload();

    /** 저장소에 있는 최신 설정. 스냅샷은 건드리지 않는다. */
    AlertSettings stored();

    /**
     * null 이 아닌 필드만 병합해 저장합니다.
     * 실행 중인 작업에는 반영되지 않고 다음 reload 부터 적용됩니다.
     *
     * @throws IllegalArgumentException 템플릿 또는 크론 식이 잘못된 경우 (아무것도 저장하지 않음)
     */
    AlertSettings save(AlertSettings patch);
}
