package com.zonewatch.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 호스트 목록 조회 조건. GET /api/hosts 의 쿼리 파라미터가 그대로 바인딩됩니다.
 */
@Getter
@Setter
@ToString
public class HostQuery {

    public static final String IGNORED_ALL = "all";

    /** 1부터 시작 */
    private int page = 1;
    private int pageSize = 20;
    /**
     * 정렬: expiry_asc, expiry_desc, domain_expiry_asc, domain_expiry_desc,
     * days_remaining_asc, days_remaining_desc, check_time_asc, check_time_desc.
     * 비어 있으면 최근 생성 순.
     */
    private String sort;
    /** 호스트명 / 해석 결과 / 존 이름 부분 일치 (대소문자 무시) */
    private String search;
    /** 상태 코드, 또는 active_only (해석 불가 제외), mismatch (호스트명 불일치) */
    private String status;
    /** "true" / "false" */
    private String proxied;
    /** "true" / "false" / "all". 비어 있으면 무시되지 않은 것만. */
    private String ignored;
    private String zone;

    /** 무시된 것과 플레이스홀더까지 모든 레코드 */
    public static HostQuery all() {
        HostQuery q = new HostQuery();
        q.ignored = IGNORED_ALL;
        q.pageSize = Integer.MAX_VALUE;
        return q;
    }
}
