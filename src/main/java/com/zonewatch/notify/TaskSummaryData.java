package com.zonewatch.notify;

/**
 * 동기화/전체 점검 완료 요약 템플릿 필드.
 * 동기화는 added/updated/deleted/skipped/total, 전체 점검은 total/active/expired/warning 을 채운다.
 */
public record TaskSummaryData(int added, int updated, int deleted, int skipped, int total,
                              int active, int expired, int warning,
                              String duration, String time, String details) {

    public static TaskSummaryData sample() {
        return new TaskSummaryData(1, 2, 3, 4, 100, 90, 5, 5, "1m 30s", "2030-01-01 09:00", "");
    }
}
