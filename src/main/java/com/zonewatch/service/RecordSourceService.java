package com.zonewatch.service;

import com.common.concurrent.BoundedChannel;
import com.common.concurrent.Deadline;
import com.zonewatch.entity.MonitoredHost;

import java.util.Optional;

public interface RecordSourceService {

    /**
     * 프로바이더의 모든 존에서 A/CNAME 레코드를 읽어 channel 로 흘려보냅니다.
     * 끝나면(실패 포함) 반드시 channel 을 닫습니다.
     *
     * @throws com.zonewatch.provider.DnsProviderException 존 목록 조회 실패, 마감 초과, 중단
     */
    StreamReport stream(BoundedChannel<MonitoredHost> channel, Deadline deadline);

    /** 레코드 한 건의 프로바이더 필드만 다시 읽음. 레코드가 없으면 empty. */
    Optional<MonitoredHost> fetchRecord(String zoneId, String recordId);
}
