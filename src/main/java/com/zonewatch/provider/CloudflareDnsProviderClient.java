package com.zonewatch.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zonewatch.config.ZonewatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Cloudflare v4 REST API 클라이언트 (Bearer 토큰 인증).
 * 응답 봉투 {"success", "errors", "result", "result_info"} 를 풀어서 돌려준다.
 */
@Slf4j
@Component
public class CloudflareDnsProviderClient implements DnsProviderClient {

    private static final int ZONE_PAGE_SIZE = 50;

    private final ZonewatchProperties props;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public CloudflareDnsProviderClient(ZonewatchProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(props.getCloudflare().getRequestTimeout())
                .build();
    }

    @Override
    public List<DnsZone> listZones() {
        List<DnsZone> zones = new ArrayList<>();
        int page = 1;
        while (true) {
            JsonNode body = get("/zones?page=" + page + "&per_page=" + ZONE_PAGE_SIZE);
            for (JsonNode z : body.path("result")) {
                zones.add(toZone(z));
            }
            int totalPages = body.path("result_info").path("total_pages").asInt(1);
            if (page >= totalPages) break;
            page++;
        }
        return zones;
    }

    @Override
    public DnsZone getZone(String zoneId) {
        return toZone(get("/zones/" + encode(zoneId)).path("result"));
    }

    @Override
    public RecordPage listRecords(String zoneId, int page, int perPage) {
        return parseRecordPage(get("/zones/" + encode(zoneId) + "/dns_records?page=" + page + "&per_page=" + perPage));
    }

    @Override
    public DnsRecord getRecord(String zoneId, String recordId) {
        return toRecord(get("/zones/" + encode(zoneId) + "/dns_records/" + encode(recordId)).path("result"));
    }

    RecordPage parseRecordPage(JsonNode body) {
        List<DnsRecord> records = new ArrayList<>();
        for (JsonNode r : body.path("result")) {
            records.add(toRecord(r));
        }
        JsonNode info = body.path("result_info");
        return new RecordPage(records, info.path("page").asInt(1), info.path("total_pages").asInt(1));
    }

    private static DnsZone toZone(JsonNode z) {
        return new DnsZone(z.path("id").asText(), z.path("name").asText(), z.path("status").asText(""));
    }

    private static DnsRecord toRecord(JsonNode r) {
        return new DnsRecord(
                r.path("id").asText(),
                r.path("zone_id").asText(""),
                r.path("zone_name").asText(""),
                r.path("name").asText(),
                r.path("type").asText(),
                r.path("content").asText(""),
                r.path("proxied").asBoolean(false),
                r.path("comment").isNull() ? "" : r.path("comment").asText(""));
    }

    /** GET 후 봉투를 검사하고 전체 바디를 돌려준다 */
    private JsonNode get(String path) {
        ZonewatchProperties.Cloudflare cfg = props.getCloudflare();
        if (cfg.getApiToken() == null || cfg.getApiToken().isBlank()) {
            throw new DnsProviderException("Cloudflare API 토큰이 설정되지 않았습니다.");
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(cfg.getBaseUrl() + path))
                .header("Authorization", "Bearer " + cfg.getApiToken())
                .header("Content-Type", "application/json")
                .timeout(cfg.getRequestTimeout())
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DnsProviderException("Cloudflare API 요청 실패: " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DnsProviderException("Cloudflare API 요청 중단: " + path, e);
        }
        return unwrap(resp.statusCode(), resp.body());
    }

    JsonNode unwrap(int status, String raw) {
        JsonNode body;
        try {
            body = objectMapper.readTree(raw);
        } catch (IOException e) {
            throw new DnsProviderException("Cloudflare 응답을 해석할 수 없습니다 (HTTP " + status + ")", e);
        }
        if (status >= 400 || !body.path("success").asBoolean(false)) {
            JsonNode errors = body.path("errors");
            String message = errors.isArray() && errors.size() > 0
                    ? errors.get(0).path("message").asText()
                    : "unknown error";
            throw new DnsProviderException("Cloudflare API 오류 (HTTP " + status + "): " + message);
        }
        return body;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
