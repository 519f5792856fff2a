package com.zonewatch.notify;

/** 추가/삭제/갱신/변경/존 이벤트 템플릿 필드: {{action}} {{domain}} {{details}} {{time}} */
public record OperationTemplateData(String action, String domain, String details, String time) {

    public static OperationTemplateData sample() {
        return new OperationTemplateData("ADD", "www.example.com", "• 레코드: A → 192.0.2.10", "2030-01-01 09:00");
    }
}
