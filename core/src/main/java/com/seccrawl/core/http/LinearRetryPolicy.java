package com.seccrawl.core.http;

import java.time.Duration;
import java.util.Objects;

/** 성공(2xx/3xx)이 아니면 모두 재시도. 지연은 baseDelay × attempt (선형). */
public final class LinearRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;

    public LinearRetryPolicy(int maxAttempts, Duration baseDelay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay").isNegative() ? Duration.ZERO : baseDelay;
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return !RetryPolicy.isSuccess(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        return baseDelay.multipliedBy(Math.max(1, attempt));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    public Duration baseDelay() { return baseDelay; }
}
