package com.zonewatch.provider;

import java.util.List;

/**
 * DNS 프로바이더 API. 모든 메서드는 실패 시 DnsProviderException 을 던진다.
 */
public interface DnsProviderClient {

    List<DnsZone> listZones();

    DnsZone getZone(String zoneId);

    /** @param page 1부터 */
    RecordPage listRecords(String zoneId, int page, int perPage);

    DnsRecord getRecord(String zoneId, String recordId);
}
