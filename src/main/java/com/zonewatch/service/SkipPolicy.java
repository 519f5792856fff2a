package com.zonewatch.service;

import com.zonewatch.config.ZonewatchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 점검하지 않을 호스트명 규칙 (DKIM, _acme-challenge 같은 서비스 레코드 등).
 * 제외된 호스트는 저장하지 않고, 삭제 대상에서도 빠진다.
 */
@Component
public class SkipPolicy {

    private final List<String> containsTokens;
    private final List<String> labelPrefixes;
    private final List<String> labelSuffixes;

    @Autowired
    public SkipPolicy(ZonewatchProperties props) {
        this(props.getSkip());
    }

    public SkipPolicy(ZonewatchProperties.Skip skip) {
        this.containsTokens = lower(skip.getContainsTokens());
        this.labelPrefixes = lower(skip.getLabelPrefixes());
        this.labelSuffixes = lower(skip.getLabelSuffixes());
    }

    public boolean shouldSkip(String hostname) {
        if (hostname == null || hostname.isBlank()) return true;
        String name = hostname.toLowerCase(Locale.ROOT);

        for (String token : containsTokens) {
            if (name.contains(token)) return true;
        }

        int dot = name.indexOf('.');
        String first = dot < 0 ? name : name.substring(0, dot);
        for (String prefix : labelPrefixes) {
            if (first.startsWith(prefix)) return true;
        }
        for (String suffix : labelSuffixes) {
            if (first.endsWith(suffix)) return true;
        }
        return false;
    }

    private static List<String> lower(List<String> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(v -> v != null && !v.isEmpty())
                .map(v -> v.toLowerCase(Locale.ROOT))
                .toList();
    }
}
