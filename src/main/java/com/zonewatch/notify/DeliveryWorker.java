package com.zonewatch.notify;

import com.zonewatch.entity.AlertSettings;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * 채널 하나의 전송 대기열과 전용 스레드.
 * 메시지는 넣은 순서대로 하나씩, 전송 사이에 interval 만큼 쉬면서 보낸다.
 * 대기열이 가득 차면 버리고, 전송 실패는 로그만 남기고 재시도하지 않는다.
 */
@Slf4j
public class DeliveryWorker {

    private record Delivery(AlertSettings settings, String message) {
    }

    private final NotificationChannel channel;
    private final BlockingQueue<Delivery> queue;
    private final Duration interval;
    private final Thread thread;
    private volatile boolean running = true;

    public DeliveryWorker(NotificationChannel channel, int capacity, Duration interval) {
        this.channel = channel;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.interval = interval;
        this.thread = new Thread(this::drain, "notify-" + channel.name());
        this.thread.setDaemon(true);
    }

    public void start() {
        thread.start();
    }

    public NotificationChannel channel() {
        return channel;
    }

    /** 막히지 않는 투입. 가득 찼으면 false. */
    public boolean offer(AlertSettings settings, String message) {
        boolean accepted = queue.offer(new Delivery(settings, message));
        if (!accepted) {
            log.warn("[{}] 알림 대기열이 가득 차 메시지를 버립니다.", channel.name());
        }
        return accepted;
    }

    public int pending() {
        return queue.size();
    }

    public void shutdown() {
        running = false;
        thread.interrupt();
    }

    private void drain() {
        while (running) {
            try {
                Delivery d = queue.take();
                try {
                    channel.send(d.settings(), d.message());
                } catch (IOException | RuntimeException e) {
                    log.error("[{}] 알림 전송 실패: {}", channel.name(), e.getMessage());
                }
                // 너무 빠른 연속 전송 방지
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("[{}] 알림 전송 스레드 종료", channel.name());
    }
}
