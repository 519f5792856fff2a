package com.zonewatch.notify;

import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;
import com.zonewatch.entity.EventType;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mustache 템플릿 렌더러.
 * 없는 필드를 참조하면 빈 문자열로 넘어가지 않고 TemplateRenderException 을 던진다.
 * 예전 형식의 {{.HTTPCode}} 표기는 {{httpCode}} 로 바꿔서 처리한다.
 */
@Component
public class TemplateRenderer {

    private static final Pattern LEGACY_FIELD = Pattern.compile("\\{\\{\\s*\\.([A-Za-z][A-Za-z0-9]*)\\s*}}");

    private final Mustache.Compiler compiler = Mustache.compiler()
            .escapeHTML(false)
            .nullValue("")
            .strictSections(true);

    public String render(String template, Object data) {
        try {
            return compiler.compile(normalize(template)).execute(data);
        } catch (MustacheException e) {
            throw new TemplateRenderException(e.getMessage(), e);
        }
    }

    /**
     * 사용자 템플릿을 해당 이벤트의 샘플 데이터로 렌더링해 본다.
     *
     * @throws TemplateRenderException 문법 오류 또는 해당 이벤트에 없는 필드 사용
     */
    public void validate(EventType type, String template) {
        render(template, sampleFor(type));
    }

    public static Object sampleFor(EventType type) {
        return switch (type) {
            case EXPIRY -> ExpiryTemplateData.sample();
            case SYNC_FINISH, SCAN_FINISH -> TaskSummaryData.sample();
            default -> OperationTemplateData.sample();
        };
    }

    static String normalize(String template) {
        Matcher m = LEGACY_FIELD.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement("{{" + decapitalize(m.group(1)) + "}}"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** HTTPCode → httpCode, IP → ip, DomainDays → domainDays */
    static String decapitalize(String name) {
        int upper = 0;
        while (upper < name.length() && Character.isUpperCase(name.charAt(upper))) upper++;
        if (upper == 0) return name;
        if (upper == name.length()) return name.toLowerCase();
        // 대문자 묶음의 마지막 글자는 다음 단어의 시작
        int cut = upper == 1 ? 1 : upper - 1;
        return name.substring(0, cut).toLowerCase() + name.substring(cut);
    }
}
