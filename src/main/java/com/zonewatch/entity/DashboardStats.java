package com.zonewatch.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/** 대시보드용 집계 (무시되지 않은 실제 레코드 기준, ignored 만 별도) */
@Getter
@Setter
@ToString
public class DashboardStats {
    private long total;
    private long zones;
    private long ignored;
    private long connectionErrors;
    private long mismatched;
    /** 인증서 15일 이내 만료 */
    private long expiringWithin15Days;
    /** 등록(WHOIS) 30일 이내 만료 */
    private long domainExpiringWithin30Days;
    private Map<String, Long> statusCounts = new LinkedHashMap<>();
    private Map<String, Long> issuerCounts = new LinkedHashMap<>();
}
