package com.zonewatch.service;

import com.common.concurrent.Deadline;
import com.zonewatch.entity.MonitoredHost;

public interface ProberService {

    /**
     * 호스트 하나를 DNS → TLS → HTTP 순서로 점검합니다.
     * 저장소에는 접근하지 않으며, 실패는 예외 대신 상태/오류 메시지로 결과에 담깁니다.
     * 반환 객체에는 관측 필드와 hostname/port 만 채워집니다.
     */
    MonitoredHost probe(String hostname, int port, Deadline deadline);
}
