package com.quizharvester.core.http;

import com.quizharvester.core.config.HarvestConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 지수 백오프: k번째 실패 뒤 base * 2^(k-1) (지터 없음).
 * Retry-After가 백오프보다 길면 그 값을 따르되 retryAfterCap으로 자른다.
 */
public final class BackoffRetryPolicy implements RetryPolicy {

    public static final Duration DEFAULT_RETRY_AFTER_CAP = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final Duration base;
    private final Duration retryAfterCap;

    public BackoffRetryPolicy(int maxAttempts, Duration base, Duration retryAfterCap) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.base = (base == null || base.isNegative()) ? Duration.ZERO : base;
        this.retryAfterCap = Objects.requireNonNull(retryAfterCap, "retryAfterCap");
    }

    public static BackoffRetryPolicy of(HarvestConfig config) {
        return new BackoffRetryPolicy(config.getMaxRetries(), config.getRetryBaseDelay(), DEFAULT_RETRY_AFTER_CAP);
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public boolean shouldRetry(int statusCode, int attempt) {
        return attempt < maxAttempts && RetryPolicy.isRetryableStatus(statusCode);
    }

    @Override
    public Duration delayAfter(int failedAttempt, Optional<Duration> retryAfter) {
        int shift = Math.min(30, Math.max(0, failedAttempt - 1)); // 오버플로 방지
        Duration backoff = base.multipliedBy(1L << shift);
        if (retryAfter == null || retryAfter.isEmpty()) return backoff;
        Duration hinted = retryAfter.get().compareTo(retryAfterCap) > 0 ? retryAfterCap : retryAfter.get();
        return hinted.compareTo(backoff) > 0 ? hinted : backoff;
    }

    public Duration base() {
        return base;
    }
}
