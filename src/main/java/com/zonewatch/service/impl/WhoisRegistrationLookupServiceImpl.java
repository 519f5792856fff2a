package com.zonewatch.service.impl;

import com.common.service.CommonService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.InternetDomainName;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.RegistrationInfo;
import com.zonewatch.probe.WhoisExpiryParser;
import com.zonewatch.service.RegistrationLookupException;
import com.zonewatch.service.RegistrationLookupService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.net.whois.WhoisClient;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 도메인 등록 만료일 조회.
 * WHOIS(IANA → TLD 레지스트리 → 레지스트라) 를 먼저 보고, 만료일이 없으면 RDAP 으로 한 번 더 찾는다.
 */
@Slf4j
@Service("RegistrationLookupService")
public class WhoisRegistrationLookupServiceImpl implements RegistrationLookupService {

    private final ZonewatchProperties props;
    private final CommonService commonService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final HttpClient rdapClient;

    /** TLD → WHOIS 서버 */
    private final Map<String, String> tldServers = new ConcurrentHashMap<>();

    public WhoisRegistrationLookupServiceImpl(ZonewatchProperties props, CommonService commonService,
                                              ObjectMapper objectMapper, Clock clock) {
        this.props = props;
        this.commonService = commonService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rdapClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(props.getWhois().getTimeout())
                .build();
    }

    @Override
    public String rootDomain(String hostname) {
        String name = hostname.trim().toLowerCase(Locale.ROOT);
        if (name.endsWith(".")) name = name.substring(0, name.length() - 1);
        try {
            InternetDomainName idn = InternetDomainName.from(name);
            if (idn.isUnderPublicSuffix()) {
                return idn.topPrivateDomain().toString();
            }
        } catch (IllegalArgumentException e) {
            log.debug("도메인 형식이 아님: {}", name);
        }
        return name;
    }

    @Override
    public RegistrationInfo lookup(String hostname) throws RegistrationLookupException {
        String root = rootDomain(hostname);
        Instant expiry = queryExpiry(root);
        return new RegistrationInfo(expiry, commonService.daysUntil(clock.instant(), expiry));
    }

    @Override
    public RegistrationInfo cachedLookup(String hostname, Instant priorExpiry, int priorDaysLeft) {
        // 1) 이전 값이 충분히 남아 있으면 다시 조회하지 않고 일수만 재계산
        boolean fresh = priorExpiry != null && priorDaysLeft >= props.getWhois().getRequeryThresholdDays();
        if (fresh || !props.getWhois().isEnabled()) {
            if (priorExpiry == null) return RegistrationInfo.UNKNOWN;
            return new RegistrationInfo(priorExpiry, commonService.daysUntil(clock.instant(), priorExpiry));
        }

        // 2) 조회, 실패하면 이전 값 유지
        try {
            return lookup(hostname);
        } catch (RegistrationLookupException e) {
            log.warn("도메인 만료일 조회 실패 ({}): {}", hostname, e.getMessage());
            return priorExpiry == null ? RegistrationInfo.UNKNOWN : new RegistrationInfo(priorExpiry, priorDaysLeft);
        }
    }

    /** 등록 도메인의 만료 시각. 테스트에서 네트워크 없이 바꿔 끼울 수 있도록 protected. */
    protected Instant queryExpiry(String root) throws RegistrationLookupException {
        IOException whoisError = null;

        // 1) WHOIS
        try {
            Instant viaWhois = whoisExpiry(root);
            if (viaWhois != null) return viaWhois;
        } catch (IOException e) {
            whoisError = e;
            log.debug("WHOIS 조회 실패 ({}): {}", root, e.getMessage());
        }

        // 2) RDAP
        if (props.getWhois().isRdapFallback()) {
            try {
                Instant viaRdap = rdapExpiry(root);
                if (viaRdap != null) return viaRdap;
            } catch (IOException e) {
                throw new RegistrationLookupException("RDAP 조회 실패: " + root, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistrationLookupException("RDAP 조회 중단: " + root, e);
            }
        }
        throw new RegistrationLookupException("만료일을 찾을 수 없습니다: " + root, whoisError);
    }

    private Instant whoisExpiry(String root) throws IOException {
        int dot = root.lastIndexOf('.');
        if (dot < 0) throw new IOException("TLD 가 없는 도메인: " + root);
        String tld = root.substring(dot + 1);

        // 1) TLD 레지스트리 서버 (IANA referral, 캐시)
        String server = tldServers.get(tld);
        if (server == null) {
            String iana = query(props.getWhois().getIanaServer(), tld);
            server = WhoisExpiryParser.findReferral(iana)
                    .orElseThrow(() -> new IOException("TLD WHOIS 서버를 찾을 수 없습니다: " + tld));
            tldServers.put(tld, server);
        }

        // 2) 레지스트리 조회
        String raw = query(server, root);
        Optional<String> date = WhoisExpiryParser.findExpiry(raw);

        // 3) thin 레지스트리면 레지스트라 서버로 한 번 더
        if (date.isEmpty()) {
            String registry = server;
            Optional<String> registrar = WhoisExpiryParser.findReferral(raw)
                    .filter(s -> !s.equalsIgnoreCase(registry));
            if (registrar.isPresent()) {
                date = WhoisExpiryParser.findExpiry(query(registrar.get(), root));
            }
        }
        return date.map(commonService::parseFlexibleDate).orElse(null);
    }

    private String query(String server, String q) throws IOException {
        int timeout = (int) props.getWhois().getTimeout().toMillis();
        WhoisClient client = new WhoisClient();
        client.setConnectTimeout(timeout);
        client.setDefaultTimeout(timeout);
        try {
            client.connect(server, WhoisClient.DEFAULT_PORT);
            client.setSoTimeout(timeout);
            return client.query(q);
        } finally {
            if (client.isConnected()) client.disconnect();
        }
    }

    /** RDAP 응답의 events 중 eventAction=expiration 의 날짜 */
    private Instant rdapExpiry(String root) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(props.getWhois().getRdapBaseUrl() + root))
                .header("Accept", "application/rdap+json")
                .timeout(props.getWhois().getTimeout())
                .GET()
                .build();
        HttpResponse<String> resp = rdapClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) return null;
        if (resp.statusCode() >= 400) {
            throw new IOException("RDAP HTTP " + resp.statusCode());
        }
        return parseRdapExpiry(resp.body());
    }

    Instant parseRdapExpiry(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        for (JsonNode event : root.path("events")) {
            if ("expiration".equalsIgnoreCase(event.path("eventAction").asText())) {
                return commonService.parseFlexibleDate(event.path("eventDate").asText());
            }
        }
        return null;
    }
}
