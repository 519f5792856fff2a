package com.zonewatch.provider;

import java.util.List;

public record RecordPage(List<DnsRecord> records, int page, int totalPages) {

    public boolean hasNext() {
        return page < totalPages;
    }
}
