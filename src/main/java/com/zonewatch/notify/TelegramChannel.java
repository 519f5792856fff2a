package com.zonewatch.notify;

import com.common.service.CommonService;
import com.zonewatch.config.ZonewatchProperties;
import com.zonewatch.entity.AlertSettings;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/** 텔레그램 Bot API sendMessage (HTML 파싱 모드) */
@Component
public class TelegramChannel implements NotificationChannel {

    private final ZonewatchProperties props;
    private final CommonService commonService;
    private final HttpClient client;

    public TelegramChannel(ZonewatchProperties props, CommonService commonService) {
        this.props = props;
        this.commonService = commonService;
        this.client = HttpClient.newBuilder()
                .connectTimeout(props.getNotify().getRequestTimeout())
                .build();
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public boolean isEnabled(AlertSettings settings) {
        return settings.isTelegramOn()
                && commonService.stringNullCheck(settings.getTelegramBotToken())
                && commonService.stringNullCheck(settings.getTelegramChatId());
    }

    /** 텔레그램으로 HTML 텍스트 메시지를 전송합니다. */
    @Override
    public void send(AlertSettings settings, String text) throws IOException, InterruptedException {
        // URL-encoded form 바디 구성
        String body = "chat_id=" + URLEncoder.encode(settings.getTelegramChatId(), StandardCharsets.UTF_8)
                + "&text=" + URLEncoder.encode(text, StandardCharsets.UTF_8)
                + "&parse_mode=HTML&disable_web_page_preview=true";

        // HTTP POST 요청 구성
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(props.getNotify().getTelegramApiBase() + "/bot" + settings.getTelegramBotToken() + "/sendMessage"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(props.getNotify().getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        // 전송 후 상태 코드 확인 (토큰/챗ID 오류는 400/401/403)
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 300) {
            throw new IOException("Telegram API HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }
}
