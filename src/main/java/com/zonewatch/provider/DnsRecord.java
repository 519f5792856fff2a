package com.zonewatch.provider;

/**
 * 프로바이더 DNS 레코드 한 건.
 *
 * @param content A 면 IP, CNAME 이면 대상 호스트명
 */
public record DnsRecord(String id, String zoneId, String zoneName, String name, String type,
                        String content, boolean proxied, String comment) {
}
