package com.zonewatch.notify;

import com.zonewatch.entity.EventType;

/** 사용자 템플릿이 비어 있을 때 쓰는 기본 알림 형식 (텔레그램 HTML 파싱 모드 기준) */
public final class DefaultTemplates {

    public static final String EXPIRY = "⚠️ <b>인증서/도메인 경고</b>\n"
            + "• 대상: <code>{{domain}}</code>\n"
            + "• 원인: {{reason}}\n"
            + "• 상태: {{status}}\n"
            + "• SSL 남은 일수: <b>{{days}}일</b>\n"
            + "• 도메인 남은 일수: {{domainDays}}일\n"
            + "• 만료일(한국시간): <code>{{expiryDate}}</code>\n"
            + "• 발급자: {{issuer}}\n"
            + "• 해석 결과: <code>{{ip}}</code>\n"
            + "• TLS: {{tls}} / HTTP: {{httpCode}}";

    public static final String ADD = "🆕 <b>도메인 추가</b>\n"
            + "• 대상: <code>{{domain}}</code>\n"
            + "{{details}}\n"
            + "• 시각: {{time}}";

    public static final String DELETE = "🗑 <b>도메인 삭제</b>\n"
            + "• 대상: <code>{{domain}}</code>\n"
            + "{{details}}\n"
            + "• 시각: {{time}}";

    public static final String RENEW = "♻️ <b>인증서 갱신 확인</b>\n"
            + "• 대상: <code>{{domain}}</code>\n"
            + "{{details}}\n"
            + "• 시각: {{time}}";

    public static final String UPDATE = "✏️ <b>도메인 변경</b>\n"
            + "• 대상: <code>{{domain}}</code>\n"
            + "{{details}}\n"
            + "• 시각: {{time}}";

    public static final String ZONE_ADD = "🌐 <b>새 존 발견</b>\n"
            + "• 존: <code>{{domain}}</code>\n"
            + "{{details}}\n"
            + "• 시각: {{time}}";

    public static final String ZONE_DELETE = "🚫 <b>존 제거</b>\n"
            + "• 존: <code>{{domain}}</code>\n"
            + "{{details}}\n"
            + "• 시각: {{time}}";

    public static final String SYNC_FINISH = "✅ <b>동기화 완료</b>\n"
            + "• 추가: {{added}} / 변경: {{updated}} / 삭제: {{deleted}} / 제외: {{skipped}}\n"
            + "• 전체 레코드: {{total}}\n"
            + "• 소요 시간: {{duration}}\n"
            + "• 시각: {{time}}";

    public static final String SCAN_FINISH = "🔎 <b>전체 점검 완료</b>\n"
            + "• 전체: {{total}} / 정상: {{active}} / 만료: {{expired}} / 임박: {{warning}}\n"
            + "• 소요 시간: {{duration}}\n"
            + "• 시각: {{time}}";

    private DefaultTemplates() {
    }

    public static String of(EventType type) {
        return switch (type) {
            case EXPIRY -> EXPIRY;
            case ADD -> ADD;
            case DELETE -> DELETE;
            case RENEW -> RENEW;
            case UPDATE -> UPDATE;
            case ZONE_ADD -> ZONE_ADD;
            case ZONE_DELETE -> ZONE_DELETE;
            case SYNC_FINISH -> SYNC_FINISH;
            case SCAN_FINISH -> SCAN_FINISH;
        };
    }
}
