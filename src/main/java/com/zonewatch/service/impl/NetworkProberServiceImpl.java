package com.zonewatch.service.impl;

import com.common.concurrent.Deadline;
import com.common.concurrent.RetryExecutor;
import com.common.service.CommonService;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.HostStatus;
import com.zonewatch.entity.MonitoredHost;
import com.zonewatch.probe.CertificateNames;
import com.zonewatch.probe.ConnectionErrorClassifier;
import com.zonewatch.probe.DnsResolver;
import com.zonewatch.probe.HostnameMatcher;
import com.zonewatch.probe.TrustAllTrustManager;
import com.zonewatch.service.ProberService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service("ProberService")
public class NetworkProberServiceImpl implements ProberService {

    public static final String MISMATCH_MESSAGE = "인증서가 호스트명을 포함하지 않습니다 (Hostname Mismatch)";

    private static final Map<String, String> TLS_LABELS = Map.of(
            "TLSv1", "TLS 1.0",
            "TLSv1.1", "TLS 1.1",
            "TLSv1.2", "TLS 1.2",
            "TLSv1.3", "TLS 1.3"
    );

    private final ZonewatchProperties props;
    private final DnsResolver dnsResolver;
    private final CommonService commonService;
    private final Clock clock;
    private final SSLContext sslContext;
    private final HttpClient httpClient;

    @Autowired
    public NetworkProberServiceImpl(ZonewatchProperties props, DnsResolver dnsResolver,
                                    CommonService commonService, Clock clock) {
        this(props, dnsResolver, commonService, clock, null);
    }

    /** httpClient 가 null 이면 리다이렉트를 따르지 않는 trust-all 클라이언트를 만든다 */
    NetworkProberServiceImpl(ZonewatchProperties props, DnsResolver dnsResolver,
                             CommonService commonService, Clock clock, HttpClient httpClient) {
        this.props = props;
        this.dnsResolver = dnsResolver;
        this.commonService = commonService;
        this.clock = clock;
        this.sslContext = TrustAllTrustManager.sslContext();
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .sslContext(sslContext)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(props.getProbe().getConnectTimeout())
                .build();
    }

    /** TLS 핸드셰이크에서 얻은 것 */
    private record TlsSnapshot(X509Certificate leaf, String protocol) {
    }

    @Override
    public MonitoredHost probe(String hostname, int port, Deadline runDeadline) {
        ZonewatchProperties.Probe cfg = props.getProbe();
        Deadline deadline = runDeadline.child(cfg.getHostTimeout());
        long start = System.nanoTime();

        MonitoredHost r = new MonitoredHost();
        r.setHostname(hostname);
        r.setPort(port);
        r.setLastCheckTime(clock.instant());

        // 1) DNS 해석
        try {
            List<String> ips = dnsResolver.resolveAddresses(hostname);
            r.setResolvedIps(new ArrayList<>(ips));
            r.setResolvedRecord(String.join(", ", ips));
            dnsResolver.lookupCname(hostname)
                    .filter(cname -> !cname.equalsIgnoreCase(hostname))
                    .ifPresent(r::setResolvedRecord);
        } catch (UnknownHostException e) {
            return unresolvable(r);
        }

        // 2) TLS 핸드셰이크 (재시도)
        RetryExecutor retry = new RetryExecutor(cfg.getRetryAttempts(), cfg.getRetryInitialDelay());
        TlsSnapshot tls;
        try {
            tls = retry.execute("TLS " + hostname, deadline,
                    () -> handshake(hostname, port, deadline),
                    e -> !ConnectionErrorClassifier.isUnresolvable(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return connectionError(r, ConnectionErrorClassifier.TIMEOUT);
        } catch (Exception e) {
            if (ConnectionErrorClassifier.isUnresolvable(e)) return unresolvable(r);
            log.debug("TLS 연결 실패 {}:{} - {}", hostname, port, e.toString());
            return connectionError(r, ConnectionErrorClassifier.classify(e));
        }

        // 3) 인증서 정보 채우기
        X509Certificate leaf = tls.leaf();
        Instant notAfter = leaf.getNotAfter().toInstant();
        int days = commonService.daysUntil(clock.instant(), notAfter);

        List<String> sans = new ArrayList<>(HostnameMatcher.dnsNames(leaf));
        sans.addAll(HostnameMatcher.ipAddresses(leaf));

        r.setIssuer(CertificateNames.issuerDisplayName(leaf));
        r.setNotBefore(leaf.getNotBefore().toInstant());
        r.setNotAfter(notAfter);
        r.setDaysRemaining(days);
        r.setSans(sans);
        r.setTlsVersion(TLS_LABELS.getOrDefault(tls.protocol(), tls.protocol()));

        boolean match = HostnameMatcher.matches(leaf, hostname);
        r.setHostnameMatch(match);
        r.setErrorMessage(match ? "" : MISMATCH_MESSAGE);
        r.setStatus(days < 0 ? HostStatus.EXPIRED : HostStatus.ACTIVE);
        r.setLatencyMs(Duration.ofNanos(System.nanoTime() - start).toMillis());

        // 4) HTTP 점검 (남은 예산이 있을 때만, 실패는 무시)
        if (deadline.remaining().compareTo(cfg.getHttpMinBudget()) > 0) {
            httpProbe(r, hostname, port, deadline);
        }
        return r;
    }

    /**
     * 단일 호스트의 인증서를 읽습니다.
     * - 신뢰 검증은 끄고(TrustAll) 인증서 체인만 받습니다.
     * - SNI 를 설정하여 가상호스팅에서도 올바른 인증서를 받습니다.
     */
    private TlsSnapshot handshake(String host, int port, Deadline deadline) throws IOException {
        ZonewatchProperties.Probe cfg = props.getProbe();
        int connectMs = timeoutMillis(deadline, cfg.getConnectTimeout());

        try (SSLSocket socket = (SSLSocket) sslContext.getSocketFactory().createSocket()) {
            // 1) 연결
            socket.connect(new InetSocketAddress(host, port), connectMs);
            socket.setSoTimeout(timeoutMillis(deadline, cfg.getHandshakeTimeout()));

            // 2) SNI
            SSLParameters params = socket.getSSLParameters();
            try {
                params.setServerNames(List.of(new SNIHostName(host)));
            } catch (IllegalArgumentException e) {
                log.trace("SNI 미사용 (IP 주소 등): {}", host);
            }
            socket.setSSLParameters(params);

            // 3) 핸드셰이크
            socket.startHandshake();

            // 4) 리프 인증서
            SSLSession session = socket.getSession();
            Certificate[] chain = session.getPeerCertificates();
            if (chain.length == 0 || !(chain[0] instanceof X509Certificate)) {
                throw new IOException("서버 인증서 체인을 읽을 수 없습니다.");
            }
            return new TlsSnapshot((X509Certificate) chain[0], session.getProtocol());
        }
    }

    /** 상태 코드와 HTTP 왕복 시간만 기록한다. latencyMs(DNS+TLS)는 건드리지 않는다. */
    void httpProbe(MonitoredHost r, String host, int port, Deadline deadline) {
        String url = "https://" + host + (port == 443 ? "" : ":" + port) + "/";
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(deadline.cap(props.getProbe().getHttpTimeout()))
                    .GET()
                    .build();
            long t0 = System.nanoTime();
            HttpResponse<Void> resp = httpClient.send(req, HttpResponse.BodyHandlers.discarding());
            r.setHttpStatusCode(resp.statusCode());
            r.setHttpLatencyMs(Duration.ofNanos(System.nanoTime() - t0).toMillis());
        } catch (IOException | IllegalArgumentException e) {
            log.debug("HTTP 점검 실패 {} - {}", url, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static int timeoutMillis(Deadline deadline, Duration limit) throws SocketTimeoutException {
        long ms = deadline.cap(limit).toMillis();
        if (ms <= 0) throw new SocketTimeoutException("점검 시간 예산 초과 (timed out)");
        return (int) Math.min(Integer.MAX_VALUE, ms);
    }

    private MonitoredHost unresolvable(MonitoredHost r) {
        r.setStatus(HostStatus.UNRESOLVABLE);
        r.setErrorMessage(ConnectionErrorClassifier.DNS_FAILURE);
        r.setResolvedIps(new ArrayList<>());
        r.setResolvedRecord("");
        r.setHostnameMatch(false);
        return r;
    }

    /** 연결 실패: 인증서 관련 값은 비우고, 불일치 경고가 같이 뜨지 않도록 hostnameMatch=true */
    private MonitoredHost connectionError(MonitoredHost r, String message) {
        r.setStatus(HostStatus.CONNECTION_ERROR);
        r.setErrorMessage(message);
        r.setHostnameMatch(true);
        r.setDaysRemaining(0);
        r.setIssuer("");
        r.setLatencyMs(0);
        return r;
    }
}
