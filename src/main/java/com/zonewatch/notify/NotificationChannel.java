package com.zonewatch.notify;

import com.zonewatch.entity.AlertSettings;

import java.io.IOException;

/** 알림 전송 채널 하나 (텔레그램, 웹훅) */
public interface NotificationChannel {

    String name();

    /** 켜져 있고 필요한 자격 증명이 모두 있는지 */
    boolean isEnabled(AlertSettings settings);

    /** settings 스냅샷의 자격 증명으로 메시지 한 건을 보낸다 */
    void send(AlertSettings settings, String message) throws IOException, InterruptedException;
}
