package com.common.service.impl;

import com.common.service.CommonService;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

@Service("CommonService")
public class CommonServiceImpl implements CommonService {

    private static final ZoneId DISPLAY_ZONE = ZoneId.of("Asia/Seoul");
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(DISPLAY_ZONE);
    private static final DateTimeFormatter DATE_TIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(DISPLAY_ZONE);

    private static final DateTimeFormatter DAY_MONTH_YEAR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("dd-MMM-yyyy")
            .toFormatter(Locale.ENGLISH);

    /**
     * WHOIS/RDAP 응답에서 흔히 보이는 날짜 표기들.
     * 앞에서부터 순서대로 시도하며, 시간대가 없는 값은 UTC 로 간주한다.
     */
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),                                                    // 2026-01-02T03:04:05Z, ...+09:00, .0Z
            s -> LocalDateTime.parse(s, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")).toInstant(ZoneOffset.UTC),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),                                        // 2026-01-02T03:04:05
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant(),                             // 2026-01-02
            s -> LocalDate.parse(s, DAY_MONTH_YEAR).atStartOfDay(ZoneOffset.UTC).toInstant(),             // 02-Jan-2026
            s -> LocalDate.parse(s, DateTimeFormatter.ofPattern("yyyy.MM.dd")).atStartOfDay(ZoneOffset.UTC).toInstant(),
            s -> LocalDate.parse(s, DateTimeFormatter.ofPattern("yyyy/MM/dd")).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    /**
     * "host[:port]" 문자열을 [host, port] 배열로 파싱합니다.
     * 스킴(https://)과 경로는 떼어내고, 포트가 없으면 defaultPort 를 사용합니다.
     * 형식이 잘못된 경우 null.
     */
    public String[] parseTarget(String line, int defaultPort) {
        if (!stringNullCheck(line)) return null;
        String s = line.trim().toLowerCase(Locale.ROOT);

        // 1) 스킴 제거
        int scheme = s.indexOf("://");
        if (scheme >= 0) s = s.substring(scheme + 3);

        // 2) 경로 제거
        int slash = s.indexOf('/');
        if (slash >= 0) s = s.substring(0, slash);
        if (s.isEmpty()) return null;

        // 3) 포트 분리
        if (s.contains(":")) {
            String[] parts = s.split(":", 2);
            try {
                int port = Integer.parseInt(parts[1].trim());
                if (port < 1 || port > 65535 || parts[0].isBlank()) return null;
                return new String[]{parts[0].trim(), String.valueOf(port)};
            } catch (NumberFormatException e) {
                return null;                                      // 잘못된 포트
            }
        }
        return new String[]{s, String.valueOf(defaultPort)};
    }

    //스트링 널 체크
    public boolean stringNullCheck(String obj){
        boolean result = true;
        if(obj == null || obj.isBlank()){
            result= false;
        }
        return result;
    }

    /**
     * 여러 형식의 날짜 문자열을 Instant 로 변환합니다.
     * "2026-01-02 (UTC+8)" 처럼 뒤에 붙은 괄호 주석은 제거합니다. 해석할 수 없으면 null.
     */
    public Instant parseFlexibleDate(String raw) {
        if (!stringNullCheck(raw)) return null;
        String s = raw.trim();
        int paren = s.indexOf(" (");
        if (paren > 0) s = s.substring(0, paren).trim();

        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(s);
            } catch (DateTimeException e) {
                // 다음 형식으로 계속
            }
        }
        return null;
    }

    /** now 부터 target 까지 남은 일수 (내림). 이미 지났으면 음수. */
    public int daysUntil(Instant now, Instant target) {
        long seconds = Duration.between(now, target).getSeconds();
        return (int) Math.floorDiv(seconds, 86400L);
    }

    public String formatDate(Instant instant) {
        return instant == null ? ZERO_DATE : DATE_FMT.format(instant);
    }

    public String formatDateTime(Instant instant) {
        return instant == null ? ZERO_DATE + " 00:00" : DATE_TIME_FMT.format(instant);
    }
}
