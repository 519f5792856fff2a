package com.common.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 지수 백오프 재시도.
 * 대기 시간은 initialDelay 에서 시작해 매번 두 배가 되고, 마감을 넘기는 대기는 하지 않는다.
 */
@Slf4j
public final class RetryExecutor {

    private final int maxAttempts;
    private final Duration initialDelay;

    public RetryExecutor(int maxAttempts, Duration initialDelay) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
    }

    public <T> T execute(String label, Deadline deadline, Callable<T> action) throws Exception {
        return execute(label, deadline, action, e -> true);
    }

    /**
     * @param retryable 이 조건을 만족하지 않는 예외는 즉시 던진다
     */
    public <T> T execute(String label, Deadline deadline, Callable<T> action,
                         Predicate<Exception> retryable) throws Exception {
        Duration delay = initialDelay;
        Exception last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e) || attempt == maxAttempts) break;

                // 대기 후에 시도할 시간이 남지 않으면 포기
                if (deadline.remaining().compareTo(delay) <= 0) break;

                log.debug("{} 실패 ({}/{}), {}ms 후 재시도: {}", label, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                Thread.sleep(delay.toMillis());
                delay = delay.multipliedBy(2);
            }
        }
        throw last;
    }
}
