package com.zonewatch.entity;

/** 알림 이벤트 종류 */
public enum EventType {
    EXPIRY,
    ADD,
    DELETE,
    RENEW,
    UPDATE,
    ZONE_ADD,
    ZONE_DELETE,
    SYNC_FINISH,
    SCAN_FINISH
}
