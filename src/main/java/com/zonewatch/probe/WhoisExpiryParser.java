package com.zonewatch.probe;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * WHOIS 원문에서 만료일 문자열과 다음 조회 서버(referral)를 찾는다.
 * 날짜 해석은 하지 않고 "키: 값" 의 값만 돌려준다.
 */
public final class WhoisExpiryParser {

    /** 레지스트리/레지스트라마다 다른 만료일 키. 앞쪽이 우선. */
    private static final List<String> EXPIRY_KEYS = List.of(
            "registry expiry date",
            "registrar registration expiration date",
            "domain expiration date",
            "expiration date",
            "expiration time",
            "expiry date",
            "expire date",
            "expires on",
            "expires",
            "paid-till",
            "renewal date",
            "valid until",
            "expire"
    );

    private static final List<String> REFERRAL_KEYS = List.of(
            "refer",
            "whois",
            "registrar whois server"
    );

    /** .kr 형식: "2026. 03. 15." */
    private static final Pattern DOTTED_DATE = Pattern.compile("^(\\d{4})\\.\\s*(\\d{1,2})\\.\\s*(\\d{1,2})\\.?$");

    private WhoisExpiryParser() {
    }

    public static Optional<String> findExpiry(String raw) {
        for (String key : EXPIRY_KEYS) {
            Optional<String> value = findValue(raw, key);
            if (value.isPresent()) return value.map(WhoisExpiryParser::normalize);
        }
        return Optional.empty();
    }

    /** IANA 의 refer/whois, 레지스트리의 Registrar WHOIS Server 값 */
    public static Optional<String> findReferral(String raw) {
        for (String key : REFERRAL_KEYS) {
            Optional<String> value = findValue(raw, key);
            if (value.isPresent()) {
                String server = value.get();
                // "whois://whois.example.net" 형식도 있음
                int scheme = server.indexOf("://");
                if (scheme >= 0) server = server.substring(scheme + 3);
                server = server.replaceAll("/+$", "");
                if (!server.isBlank()) return Optional.of(server.toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> findValue(String raw, String key) {
        if (raw == null) return Optional.empty();
        for (String line : raw.split("\\r?\\n")) {
            String trimmed = line.trim();
            int colon = trimmed.indexOf(':');
            if (colon <= 0) continue;
            String k = trimmed.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (!k.equals(key)) continue;
            String v = trimmed.substring(colon + 1).trim();
            if (!v.isEmpty()) return Optional.of(v);
        }
        return Optional.empty();
    }

    static String normalize(String value) {
        Matcher m = DOTTED_DATE.matcher(value);
        if (m.matches()) {
            return String.format("%s-%02d-%02d", m.group(1), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        }
        return value;
    }
}
