package com.zonewatch.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 전역 알림/스케줄 설정 문서 (단일 건).
 * 모든 필드가 박싱 타입인 이유는 저장 시 null 이 아닌 필드만 덮어쓰는 병합 규칙 때문이다.
 * null 플래그는 꺼진 것으로, 빈 템플릿은 기본 템플릿으로 취급한다.
 */
@Getter
@Setter
@ToString
public class AlertSettings {

    /** API 응답에서 비밀 값 대신 내려가는 문자열. 저장 요청에 그대로 돌아오면 무시한다. */
    public static final String SECRET_MASK = "******";

    // ---- 웹훅 ----
    private Boolean webhookEnabled;
    private String webhookUrl;
    private String webhookUser;
    @ToString.Exclude
    private String webhookPassword;
    /** Bearer 토큰 (설정되면 Basic 인증 대신 사용) */
    @ToString.Exclude
    private String webhookToken;

    // ---- 텔레그램 ----
    private Boolean telegramEnabled;
    @ToString.Exclude
    private String telegramBotToken;
    private String telegramChatId;

    // ---- 이벤트별 알림 스위치 / 템플릿 ----
    private Boolean notifyOnExpiry;
    private String expiryTemplate;
    private Boolean notifyOnAdd;
    private String addTemplate;
    private Boolean notifyOnDelete;
    private String deleteTemplate;
    private Boolean notifyOnRenew;
    private String renewTemplate;
    private Boolean notifyOnUpdate;
    private String updateTemplate;
    private Boolean notifyOnZoneAdd;
    private String zoneAddTemplate;
    private Boolean notifyOnZoneDelete;
    private String zoneDeleteTemplate;
    private Boolean notifyOnSyncFinish;
    private String syncFinishTemplate;
    private Boolean notifyOnScanFinish;
    private String scanFinishTemplate;

    // ---- 스케줄 ----
    private Boolean syncEnabled;
    private String syncSchedule;
    private Boolean scanEnabled;
    private String scanSchedule;

    public boolean isNotifyEnabled(EventType type) {
        Boolean flag = switch (type) {
            case EXPIRY -> notifyOnExpiry;
            case ADD -> notifyOnAdd;
            case DELETE -> notifyOnDelete;
            case RENEW -> notifyOnRenew;
            case UPDATE -> notifyOnUpdate;
            case ZONE_ADD -> notifyOnZoneAdd;
            case ZONE_DELETE -> notifyOnZoneDelete;
            case SYNC_FINISH -> notifyOnSyncFinish;
            case SCAN_FINISH -> notifyOnScanFinish;
        };
        return Boolean.TRUE.equals(flag);
    }

    /** 사용자가 지정한 템플릿 (없으면 null) */
    public String templateFor(EventType type) {
        return switch (type) {
            case EXPIRY -> expiryTemplate;
            case ADD -> addTemplate;
            case DELETE -> deleteTemplate;
            case RENEW -> renewTemplate;
            case UPDATE -> updateTemplate;
            case ZONE_ADD -> zoneAddTemplate;
            case ZONE_DELETE -> zoneDeleteTemplate;
            case SYNC_FINISH -> syncFinishTemplate;
            case SCAN_FINISH -> scanFinishTemplate;
        };
    }

    public boolean isTelegramOn() {
        return Boolean.TRUE.equals(telegramEnabled);
    }

    public boolean isWebhookOn() {
        return Boolean.TRUE.equals(webhookEnabled);
    }

    public boolean isSyncOn() {
        return Boolean.TRUE.equals(syncEnabled);
    }

    public boolean isScanOn() {
        return Boolean.TRUE.equals(scanEnabled);
    }

    /** patch 의 null 이 아닌 필드만 이 문서에 덮어쓴다 */
    public void mergeFrom(AlertSettings patch) {
        if (patch.webhookEnabled != null) webhookEnabled = patch.webhookEnabled;
        if (patch.webhookUrl != null) webhookUrl = patch.webhookUrl;
        if (patch.webhookUser != null) webhookUser = patch.webhookUser;
        if (isSecretValue(patch.webhookPassword)) webhookPassword = patch.webhookPassword;
        if (isSecretValue(patch.webhookToken)) webhookToken = patch.webhookToken;
        if (patch.telegramEnabled != null) telegramEnabled = patch.telegramEnabled;
        if (isSecretValue(patch.telegramBotToken)) telegramBotToken = patch.telegramBotToken;
        if (patch.telegramChatId != null) telegramChatId = patch.telegramChatId;
        if (patch.notifyOnExpiry != null) notifyOnExpiry = patch.notifyOnExpiry;
        if (patch.expiryTemplate != null) expiryTemplate = patch.expiryTemplate;
        if (patch.notifyOnAdd != null) notifyOnAdd = patch.notifyOnAdd;
        if (patch.addTemplate != null) addTemplate = patch.addTemplate;
        if (patch.notifyOnDelete != null) notifyOnDelete = patch.notifyOnDelete;
        if (patch.deleteTemplate != null) deleteTemplate = patch.deleteTemplate;
        if (patch.notifyOnRenew != null) notifyOnRenew = patch.notifyOnRenew;
        if (patch.renewTemplate != null) renewTemplate = patch.renewTemplate;
        if (patch.notifyOnUpdate != null) notifyOnUpdate = patch.notifyOnUpdate;
        if (patch.updateTemplate != null) updateTemplate = patch.updateTemplate;
        if (patch.notifyOnZoneAdd != null) notifyOnZoneAdd = patch.notifyOnZoneAdd;
        if (patch.zoneAddTemplate != null) zoneAddTemplate = patch.zoneAddTemplate;
        if (patch.notifyOnZoneDelete != null) notifyOnZoneDelete = patch.notifyOnZoneDelete;
        if (patch.zoneDeleteTemplate != null) zoneDeleteTemplate = patch.zoneDeleteTemplate;
        if (patch.notifyOnSyncFinish != null) notifyOnSyncFinish = patch.notifyOnSyncFinish;
        if (patch.syncFinishTemplate != null) syncFinishTemplate = patch.syncFinishTemplate;
        if (patch.notifyOnScanFinish != null) notifyOnScanFinish = patch.notifyOnScanFinish;
        if (patch.scanFinishTemplate != null) scanFinishTemplate = patch.scanFinishTemplate;
        if (patch.syncEnabled != null) syncEnabled = patch.syncEnabled;
        if (patch.syncSchedule != null) syncSchedule = patch.syncSchedule;
        if (patch.scanEnabled != null) scanEnabled = patch.scanEnabled;
        if (patch.scanSchedule != null) scanSchedule = patch.scanSchedule;
    }

    /** 비밀 값(웹훅 비밀번호/토큰, 봇 토큰)을 가린 복사본 */
    public AlertSettings masked() {
        AlertSettings c = copy();
        c.webhookPassword = mask(webhookPassword);
        c.webhookToken = mask(webhookToken);
        c.telegramBotToken = mask(telegramBotToken);
        return c;
    }

    private static String mask(String secret) {
        return secret == null || secret.isEmpty() ? secret : SECRET_MASK;
    }

    private static boolean isSecretValue(String value) {
        return value != null && !SECRET_MASK.equals(value);
    }

    public AlertSettings copy() {
        AlertSettings c = new AlertSettings();
        c.mergeFrom(this);
        return c;
    }
}
