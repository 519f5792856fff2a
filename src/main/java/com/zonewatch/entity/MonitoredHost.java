package com.zonewatch.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * DNS 프로바이더에서 발견한 호스트 한 건과 그 점검 결과.
 * 저장소에 보관되며 컨트롤러에서 JSON 으로 직렬화됩니다.
 *
 * <p>필드는 소유자별로 나뉩니다.
 * 프로바이더 필드는 동기화 때마다 덮어쓰고, 사용자 필드(ignored/port/autoRenew)는
 * 사용자 조작으로만 바뀌며, 관측 필드는 점검 결과로 채워집니다.
 */
@Getter
@Setter
@ToString
public class MonitoredHost {

    public static final String TYPE_PLACEHOLDER = "placeholder";
    public static final String PLACEHOLDER_TARGET = "Auto Generated Placeholder";
    public static final int DEFAULT_PORT = 443;

    // ---- 식별 ----
    /** 저장소 id */
    private String id;
    private String hostname;
    private String providerZoneId;
    private String providerRecordId;

    // ---- 프로바이더 소유 ----
    private String zoneName;
    /** A / CNAME / placeholder */
    private String recordType;
    /** 레코드 값 (IP 또는 CNAME 대상) */
    private String upstreamTarget;
    private boolean proxied;
    private String comment;

    // ---- 사용자 소유 ----
    private boolean ignored;
    private int port = DEFAULT_PORT;
    private boolean autoRenew;

    // ---- 관측 ----
    private String issuer;
    private Instant notBefore;
    private Instant notAfter;
    private int daysRemaining;
    private List<String> sans = new ArrayList<>();
    private String tlsVersion;
    private int httpStatusCode;
    /** DNS + TLS 소요 시간 */
    private long latencyMs;
    /** HTTP 응답까지 걸린 시간 (HTTP 점검을 못 했으면 0) */
    private long httpLatencyMs;
    private boolean hostnameMatch;
    private List<String> resolvedIps = new ArrayList<>();
    private String resolvedRecord;
    private Instant domainExpiryDate;
    private int domainDaysLeft;
    private Instant lastCheckTime;
    private Instant lastAlertTime;
    private HostStatus status = HostStatus.PENDING;
    private String errorMessage;

    private Instant createdAt;

    /** 레코드 한 건으로부터 아직 점검하지 않은 대상을 만든다 */
    public static MonitoredHost pending(String hostname, String zoneId, String zoneName, String recordId,
                                       String recordType, String target, boolean proxied, String comment) {
        MonitoredHost h = new MonitoredHost();
        h.hostname = hostname;
        h.providerZoneId = zoneId;
        h.zoneName = zoneName;
        h.providerRecordId = recordId;
        h.recordType = recordType;
        h.upstreamTarget = target;
        h.proxied = proxied;
        h.comment = comment;
        h.status = HostStatus.PENDING;
        return h;
    }

    /** 실제 레코드가 하나도 없는 존을 목록에 남겨두기 위한 자리표시 */
    public static MonitoredHost placeholder(String zoneName, String zoneId) {
        MonitoredHost h = new MonitoredHost();
        h.hostname = zoneName;
        h.zoneName = zoneName;
        h.providerZoneId = zoneId;
        h.providerRecordId = "";
        h.recordType = TYPE_PLACEHOLDER;
        h.upstreamTarget = PLACEHOLDER_TARGET;
        h.status = HostStatus.SKIPPED_ZONE;
        h.ignored = true;
        h.hostnameMatch = true;
        return h;
    }

    public boolean isPlaceholder() {
        return TYPE_PLACEHOLDER.equals(recordType);
    }

    public MonitoredHost copy() {
        MonitoredHost c = new MonitoredHost();
        c.id = id;
        c.copyProviderFieldsFrom(this);
        c.copyUserFieldsFrom(this);
        c.copyObservedFieldsFrom(this);
        c.domainExpiryDate = domainExpiryDate;
        c.domainDaysLeft = domainDaysLeft;
        c.lastAlertTime = lastAlertTime;
        c.createdAt = createdAt;
        return c;
    }

    public void copyProviderFieldsFrom(MonitoredHost src) {
        hostname = src.hostname;
        providerZoneId = src.providerZoneId;
        providerRecordId = src.providerRecordId;
        zoneName = src.zoneName;
        recordType = src.recordType;
        upstreamTarget = src.upstreamTarget;
        proxied = src.proxied;
        comment = src.comment;
    }

    public void copyUserFieldsFrom(MonitoredHost src) {
        ignored = src.ignored;
        port = src.port;
        autoRenew = src.autoRenew;
    }

    /** 점검(DNS/TLS/HTTP)으로 얻는 필드. 등록 만료와 알림 시각은 포함하지 않는다. */
    public void copyObservedFieldsFrom(MonitoredHost src) {
        issuer = src.issuer;
        notBefore = src.notBefore;
        notAfter = src.notAfter;
        daysRemaining = src.daysRemaining;
        sans = src.sans == null ? new ArrayList<>() : new ArrayList<>(src.sans);
        tlsVersion = src.tlsVersion;
        httpStatusCode = src.httpStatusCode;
        latencyMs = src.latencyMs;
        httpLatencyMs = src.httpLatencyMs;
        hostnameMatch = src.hostnameMatch;
        resolvedIps = src.resolvedIps == null ? new ArrayList<>() : new ArrayList<>(src.resolvedIps);
        resolvedRecord = src.resolvedRecord;
        lastCheckTime = src.lastCheckTime;
        status = src.status;
        errorMessage = src.errorMessage;
    }
}
