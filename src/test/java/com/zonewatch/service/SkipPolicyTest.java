package com.zonewatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.zonewatch.config.ZonewatchProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class SkipPolicyTest {

    @Test
    void default_rules_skip_service_records() {
        SkipPolicy policy = new SkipPolicy(new ZonewatchProperties.Skip());
        assertThat(policy.shouldSkip("selector1._domainkey.example.com")).isTrue();
        assertThat(policy.shouldSkip("_acme-challenge.example.com")).isTrue();
        assertThat(policy.shouldSkip("_DMARC.example.com")).isTrue();
        assertThat(policy.shouldSkip("www.example.com")).isFalse();
        assertThat(policy.shouldSkip("api_v2.example.com")).isFalse();
        assertThat(policy.shouldSkip("")).isTrue();
    }

    @Test
    void label_suffix_rule_applies_to_first_label_only() {
        ZonewatchProperties.Skip skip = new ZonewatchProperties.Skip();
        skip.setLabelSuffixes(List.of("-internal"));
        SkipPolicy policy = new SkipPolicy(skip);
        assertThat(policy.shouldSkip("db-internal.example.com")).isTrue();
        assertThat(policy.shouldSkip("www.corp-internal.example.com")).isFalse();
    }
}
