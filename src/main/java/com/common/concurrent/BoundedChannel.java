package com.common.concurrent;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 생산자 하나와 소비자 하나를 잇는 고정 크기 채널.
 * <ul>
 *   <li>send: 공간이 날 때까지 대기한다 (마감/인터럽트 시 포기)</li>
 *   <li>close: 여러 번 호출해도 안전하다</li>
 *   <li>receive: 닫힌 뒤 남은 항목을 모두 꺼내면 empty 를 돌려준다</li>
 * </ul>
 */
public class BoundedChannel<T> {

    private static final long POLL_MILLIS = 200;

    private final BlockingQueue<T> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BoundedChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 항목을 넣는다. 큐가 가득 차 있으면 기다린다.
     *
     * @return 넣었으면 true, 마감이 지나 포기했으면 false
     */
    public boolean send(T item, Deadline deadline) throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("channel is closed");
        }
        while (!queue.offer(item, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (deadline.isExpired()) return false;
        }
        return true;
    }

    /** 다음 항목. 채널이 닫히고 비었거나 마감이 지나면 empty. */
    public Optional<T> receive(Deadline deadline) throws InterruptedException {
        while (true) {
            T item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (item != null) return Optional.of(item);
            if (closed.get() && queue.isEmpty()) return Optional.empty();
            if (deadline.isExpired()) return Optional.empty();
        }
    }

    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int size() {
        return queue.size();
    }
}
