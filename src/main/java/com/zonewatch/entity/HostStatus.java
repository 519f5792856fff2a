package com.zonewatch.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** 모니터링 대상의 점검 상태 */
public enum HostStatus {
    ACTIVE("active"),
    EXPIRED("expired"),
    WARNING("warning"),
    UNRESOLVABLE("unresolvable"),
    CONNECTION_ERROR("connection_error"),
    PENDING("pending"),
    /** 존 플레이스홀더 전용 */
    SKIPPED_ZONE("skipped_zone");

    private final String code;

    HostStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static HostStatus fromCode(String code) {
        for (HostStatus s : values()) {
            if (s.code.equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("unknown status: " + code);
    }
}
