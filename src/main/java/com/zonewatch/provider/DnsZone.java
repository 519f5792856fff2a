package com.zonewatch.provider;

public record DnsZone(String id, String name, String status) {
}
