package com.zonewatch.notify;

import com.common.service.CommonService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.AlertSettings;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * 범용 웹훅. {"text": "..."} 를 POST 한다.
 * 토큰이 있으면 Bearer, 사용자명이 있으면 Basic 인증을 붙인다.
 */
@Component
public class WebhookChannel implements NotificationChannel {

    private final ZonewatchProperties props;
    private final CommonService commonService;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public WebhookChannel(ZonewatchProperties props, CommonService commonService, ObjectMapper objectMapper) {
        this.props = props;
        this.commonService = commonService;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(props.getNotify().getRequestTimeout())
                .build();
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isEnabled(AlertSettings settings) {
        return settings.isWebhookOn() && commonService.stringNullCheck(settings.getWebhookUrl());
    }

    @Override
    public void send(AlertSettings settings, String message) throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(Map.of("text", message));

        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(settings.getWebhookUrl()))
                .header("Content-Type", "application/json")
                .timeout(props.getNotify().getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(body));

        String auth = authorization(settings);
        if (auth != null) req.header("Authorization", auth);

        HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 300) {
            throw new IOException("Webhook HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }

    String authorization(AlertSettings settings) {
        if (commonService.stringNullCheck(settings.getWebhookToken())) {
            return "Bearer " + settings.getWebhookToken();
        }
        if (commonService.stringNullCheck(settings.getWebhookUser())) {
            String password = settings.getWebhookPassword() == null ? "" : settings.getWebhookPassword();
            String raw = settings.getWebhookUser() + ":" + password;
            return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }
}
