package com.zonewatch.service;

import com.zonewatch.provider.DnsZone;

import java.util.List;
import java.util.Set;

/**
 * 레코드 스트리밍 결과.
 *
 * @param zones       레코드를 끝까지 읽은 존
 * @param failedZones 레코드 조회에 실패한 존 이름 (이 존의 기존 호스트는 삭제하지 않는다)
 */
public record StreamReport(List<DnsZone> zones, Set<String> failedZones) {
}
