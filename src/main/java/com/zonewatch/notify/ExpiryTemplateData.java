package com.zonewatch.notify;

/**
 * 만료/장애 경고 템플릿에서 쓸 수 있는 필드.
 * {{domain}} {{status}} {{days}} {{domainDays}} {{expiryDate}} {{issuer}} {{ip}} {{tls}} {{httpCode}} {{record}} {{reason}}
 */
public record ExpiryTemplateData(String domain, String status, int days, int domainDays, String expiryDate,
                                 String issuer, String ip, String tls, int httpCode, String record, String reason) {

    public static ExpiryTemplateData sample() {
        return new ExpiryTemplateData("www.example.com", "active", 12, 200, "2030-01-01 09:00",
                "R3", "192.0.2.10", "TLS 1.3", 200, "192.0.2.10", "SSL 인증서 만료 임박 (12일)");
    }
}
