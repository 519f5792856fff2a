package com.zonewatch.notify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.zonewatch.entity.EventType;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    void every_default_template_renders_with_its_sample() {
        for (EventType type : EventType.values()) {
            assertThatCode(() -> renderer.validate(type, DefaultTemplates.of(type)))
                    .as(type.name())
                    .doesNotThrowAnyException();
        }
    }

    @Test
    void renders_operation_fields_without_escaping_html() {
        String out = renderer.render("<b>{{action}}</b> {{domain}}: {{details}}",
                new OperationTemplateData("ADD", "www.example.com", "• a & b", "2030-01-01 09:00"));
        assertThat(out).isEqualTo("<b>ADD</b> www.example.com: • a & b");
    }

    @Test
    void legacy_dot_fields_are_rewritten() {
        assertThat(TemplateRenderer.normalize("{{.Domain}} {{ .HTTPCode }} {{.IP}}"))
                .isEqualTo("{{domain}} {{httpCode}} {{ip}}");
        String out = renderer.render("{{.Domain}} -> {{.HTTPCode}}", ExpiryTemplateData.sample());
        assertThat(out).startsWith(ExpiryTemplateData.sample().domain() + " -> ");
    }

    @Test
    void decapitalizes_acronyms() {
        assertThat(TemplateRenderer.decapitalize("HTTPCode")).isEqualTo("httpCode");
        assertThat(TemplateRenderer.decapitalize("IP")).isEqualTo("ip");
        assertThat(TemplateRenderer.decapitalize("DomainDays")).isEqualTo("domainDays");
        assertThat(TemplateRenderer.decapitalize("days")).isEqualTo("days");
    }

    @Test
    void unknown_field_fails_closed() {
        assertThatThrownBy(() -> renderer.validate(EventType.ADD, "{{domain}} {{notAField}}"))
                .isInstanceOf(TemplateRenderException.class);
    }

    @Test
    void summary_fields_are_not_available_to_operation_events() {
        assertThatThrownBy(() -> renderer.validate(EventType.DELETE, "{{added}}"))
                .isInstanceOf(TemplateRenderException.class);
        assertThatCode(() -> renderer.validate(EventType.SYNC_FINISH, "{{added}} / {{total}}"))
                .doesNotThrowAnyException();
    }

    @Test
    void syntax_error_fails() {
        assertThatThrownBy(() -> renderer.render("{{#open}} never closed", OperationTemplateData.sample()))
                .isInstanceOf(TemplateRenderException.class);
    }
}
