package com.zonewatch.config;

import com.zonewatch.entity.AlertSettings;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * application.properties 의 "zonewatch.*" 키들을 객체로 바인딩하는 설정 클래스입니다.
 * - @Component : 컴포넌트 스캔 대상으로 등록 (빈으로 관리)
 * - @ConfigurationProperties(prefix = "zonewatch") : "zonewatch." 접두사의 속성을 이 클래스 필드에 주입
 * - Duration 필드는 "15s", "1100ms", "20m" 형식으로 지정할 수 있습니다.
 */
@Component
@ConfigurationProperties(prefix = "zonewatch")
@ToString
@Getter
@Setter
public class ZonewatchProperties {

    /** Cloudflare API 설정 */
    private Cloudflare cloudflare = new Cloudflare();

    /** DNS / TLS / HTTP 점검 설정 */
    private Probe probe = new Probe();

    /** 도메인 등록 만료(WHOIS/RDAP) 조회 설정 */
    private Whois whois = new Whois();

    /** 동기화 작업 설정 */
    private Sync sync = new Sync();

    /** 전체 재점검 작업 설정 */
    private Scan scan = new Scan();

    /** 알림 전송 설정 */
    private Notify notify = new Notify();

    /** 점검 제외 규칙 */
    private Skip skip = new Skip();

    /** 저장소가 비어 있을 때 사용할 초기 알림/스케줄 설정 */
    private AlertSettings settings = new AlertSettings();

    @ToString
    @Getter
    @Setter
    public static class Cloudflare {
        /** API 토큰 (Zone:Read, DNS:Read 권한) */
        @ToString.Exclude
        private String apiToken;
        private String baseUrl = "https://api.cloudflare.com/client/v4";
        /** 지정하면 이 존들만, 비어 있으면 계정의 모든 존 */
        private List<String> zoneIds = new ArrayList<>();
        private int pageSize = 100;
        /** 페이지 요청 사이 대기 */
        private Duration pageDelay = Duration.ofMillis(200);
        /** 존 사이 대기 */
        private Duration zoneDelay = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @ToString
    @Getter
    @Setter
    public static class Probe {
        private int defaultPort = 443;
        /** 호스트 1건 점검의 전체 예산 */
        private Duration hostTimeout = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Duration handshakeTimeout = Duration.ofSeconds(15);
        /** TLS 핸드셰이크 재시도 횟수 (첫 시도 포함) */
        private int retryAttempts = 3;
        /** 첫 재시도 전 대기, 이후 두 배씩 */
        private Duration retryInitialDelay = Duration.ofSeconds(5);
        private Duration httpTimeout = Duration.ofSeconds(15);
        /** 남은 예산이 이보다 적으면 HTTP 점검을 건너뜀 */
        private Duration httpMinBudget = Duration.ofSeconds(2);
    }

    @ToString
    @Getter
    @Setter
    public static class Whois {
        private boolean enabled = true;
        /** 이전 조회 결과의 남은 일수가 이 값 미만일 때만 다시 조회 */
        private int requeryThresholdDays = 60;
        private Duration timeout = Duration.ofSeconds(10);
        private String ianaServer = "whois.iana.org";
        /** WHOIS 로 만료일을 못 찾으면 RDAP 조회 */
        private boolean rdapFallback = true;
        private String rdapBaseUrl = "https://rdap.org/domain/";
    }

    @ToString
    @Getter
    @Setter
    public static class Sync {
        private int concurrency = 15;
        private int channelCapacity = 500;
        private Duration timeout = Duration.ofMinutes(20);
        /** 상세 알림 한 건에 담는 항목 수 */
        private int detailsBatchSize = 20;
    }

    @ToString
    @Getter
    @Setter
    public static class Scan {
        private int concurrency = 10;
        private Duration timeout = Duration.ofMinutes(30);
    }

    @ToString
    @Getter
    @Setter
    public static class Notify {
        /** 채널별 대기열 크기. 가득 차면 버림 */
        private int queueCapacity = 1000;
        /** 채널별 전송 간격 */
        private Duration sendInterval = Duration.ofMillis(1100);
        /** 같은 호스트 만료 알림 최소 간격 */
        private Duration antiSpamWindow = Duration.ofHours(24);
        /** 만료 임계치(일) : 이 값 미만으로 남았으면 알림 대상 */
        private int expiryThresholdDays = 30;
        private Duration requestTimeout = Duration.ofSeconds(10);
        private String telegramApiBase = "https://api.telegram.org";
    }

    @ToString
    @Getter
    @Setter
    public static class Skip {
        /** 호스트명에 포함되면 제외 */
        private List<String> containsTokens = new ArrayList<>(List.of("_domainkey"));
        /** 첫 라벨이 이 문자열로 시작하면 제외 */
        private List<String> labelPrefixes = new ArrayList<>(List.of("_"));
        /** 첫 라벨이 이 문자열로 끝나면 제외 (기본 없음) */
        private List<String> labelSuffixes = new ArrayList<>();
    }
}
