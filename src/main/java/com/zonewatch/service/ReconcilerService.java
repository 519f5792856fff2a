package com.zonewatch.service;

import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.ScanResult;
import com.zonewatch.entity.SyncResult;

public interface ReconcilerService {

    /**
     * 프로바이더 레코드와 저장소를 맞춥니다.
     * 레코드 수집 → 병렬 점검/병합 → 삭제 → 플레이스홀더 정리 순서로 진행합니다.
     * 같은 종류의 실행이 이미 돌고 있으면 바로 실패 결과를 돌려줍니다.
     */
    SyncResult performSync();

    /** 무시되지 않은 모든 호스트를 다시 점검하고 만료 경고를 평가합니다. */
    ScanResult performScan();

    /**
     * 호스트 한 건을 점검해 저장하고 변경 알림을 보냅니다.
     *
     * @param checkExpiry true 면 만료 경고도 평가 (false 면 새로 생긴 연결 오류만)
     */
    MonitoredHost scanOne(MonitoredHost host, boolean checkExpiry);

    /**
     * 저장된 호스트 한 건을 프로바이더 값으로 갱신한 뒤 다시 점검합니다.
     *
     * @throws java.util.NoSuchElementException 해당 id 가 없음
     */
    MonitoredHost rescan(String id);

    /** 임의의 호스트를 점검만 하고 저장하지 않습니다 (등록 만료일은 캐시 없이 조회). */
    MonitoredHost inspect(String hostname, int port);
}
