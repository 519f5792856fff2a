package com.zonewatch.schedule;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 같은 종류의 작업(sync, scan)이 겹쳐 실행되지 않도록 막는다.
 * 크론과 수동 실행(API)이 같은 잠금을 쓴다.
 */
@Slf4j
@Component
public class RunCoordinator {

    public static final String SYNC = "sync";
    public static final String SCAN = "scan";

    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();

    public boolean tryAcquire(String kind) {
        boolean acquired = flag(kind).compareAndSet(false, true);
        if (!acquired) {
            log.warn("{} 작업이 이미 실행 중이라 건너뜁니다.", kind);
        }
        return acquired;
    }

    public void release(String kind) {
        flag(kind).set(false);
    }

    public boolean isRunning(String kind) {
        return flag(kind).get();
    }

    private AtomicBoolean flag(String kind) {
        return running.computeIfAbsent(kind, k -> new AtomicBoolean(false));
    }
}
