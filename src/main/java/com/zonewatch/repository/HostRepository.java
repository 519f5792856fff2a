package com.zonewatch.repository;

import com.zonewatch.entity.DashboardStats;
import com.zonewatch.entity.HostQuery;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.entity.PageResult;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 모니터링 대상 저장소.
 * 반환하는 객체는 모두 복사본이므로 수정해도 저장된 값에는 영향이 없다.
 */
public interface HostRepository {

    /**
     * (hostname, providerRecordId) 키로 삽입 또는 갱신한다.
     * 갱신 시 프로바이더/관측 필드만 덮어쓰고 사용자 필드(ignored, port, autoRenew)와
     * createdAt 은 유지한다. 최초 삽입 때만 createdAt 을 기록하고 ignored=false 로 둔다.
     *
     * @return 저장된 상태 (id 포함)
     */
    MonitoredHost upsert(MonitoredHost host);

    /** 그대로 새 레코드로 추가한다 (플레이스홀더용). 같은 키가 있으면 IllegalStateException. */
    MonitoredHost create(MonitoredHost host);

    PageResult<MonitoredHost> list(HostQuery query);

    /** 무시된 것과 플레이스홀더를 포함한 전체 */
    List<MonitoredHost> findAll();

    Optional<MonitoredHost> findById(String id);

    /** 같은 호스트명의 레코드 중 하나 */
    Optional<MonitoredHost> findByHostname(String hostname);

    boolean delete(String id);

    /** @return 변경된 건수 */
    int batchUpdateIgnored(Collection<String> ids, boolean ignored);

    /** 사용자 필드만 갱신. null 인자는 그대로 둔다. */
    Optional<MonitoredHost> updateUserSettings(String id, Boolean ignored, Integer port, Boolean autoRenew);

    /**
     * 점검 결과(관측 필드, 등록 만료)와 프로바이더 필드를 id 로 찾아 반영한다.
     *
     * @return 해당 id 가 없으면 false (점검 중 삭제된 경우)
     */
    boolean updateProbeFields(MonitoredHost host);

    void updateLastAlertTime(String id, Instant time);

    /** 무시되지 않은 레코드들의 존 이름 (정렬) */
    List<String> findZoneNames();

    DashboardStats getStatistics();
}
