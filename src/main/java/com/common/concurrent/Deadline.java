package com.common.concurrent;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 마감 시각과 취소 신호를 함께 들고 다니는 객체.
 * child() 로 만든 하위 마감은 부모가 만료되거나 취소되면 함께 만료된다.
 */
public final class Deadline {

    private final long endNanos;
    private final Deadline parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private Deadline(long endNanos, Deadline parent) {
        this.endNanos = endNanos;
        this.parent = parent;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(System.nanoTime() + timeout.toNanos(), null);
    }

    /** 이 마감과 now+timeout 중 이른 쪽을 마감으로 하는 하위 마감 */
    public Deadline child(Duration timeout) {
        long end = Math.min(endNanos, System.nanoTime() + timeout.toNanos());
        return new Deadline(end, this);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public boolean isExpired() {
        return isCancelled() || System.nanoTime() - endNanos >= 0;
    }

    public Duration remaining() {
        if (isCancelled()) return Duration.ZERO;
        long left = endNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    /** 남은 시간과 limit 중 짧은 쪽 (소켓 타임아웃 계산용) */
    public Duration cap(Duration limit) {
        Duration left = remaining();
        return left.compareTo(limit) < 0 ? left : limit;
    }
}
