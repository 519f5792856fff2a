package com.zonewatch.service;

import com.zonewatch.entity.AlertSettings;
import com.zonewatch.entity.EventType;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.notify.TaskSummaryData;

import java.util.List;
import java.util.Map;

public interface NotifierService {

    /**
     * ADD / DELETE / RENEW / UPDATE / ZONE_ADD / ZONE_DELETE 이벤트.
     * 이벤트 스위치가 꺼져 있으면 아무것도 하지 않는다.
     */
    void notifyOperation(EventType type, String domain, String details);

    /** SYNC_FINISH / SCAN_FINISH 요약 */
    void notifyTaskFinish(EventType type, TaskSummaryData summary);

    /** 동기화 상세 목록을 batch 단위로 나눠 보낸다 (SYNC_FINISH 스위치를 따름) */
    void notifyTaskDetails(String title, List<String> lines);

    /**
     * 만료/장애 조건을 검사해 경고를 보낸다. 같은 호스트는 24시간에 한 번만.
     *
     * @return 실제로 전송 대기열에 넣었으면 true
     */
    boolean checkAndNotify(MonitoredHost host);

    /**
     * 저장하지 않은 설정으로 즉시 테스트 메시지를 보낸다.
     *
     * @return 채널 이름 → "ok" 또는 오류 메시지
     */
    Map<String, String> sendTestMessage(AlertSettings settings);
}
