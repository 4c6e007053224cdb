package com.quizharvester.core.http;

import java.time.Duration;
import java.util.Optional;

/**
 * 요청 1건의 재시도 여부와 대기 시간.
 * attempt는 1부터(방금 실패한 시도 번호), statusCode -1 = 전송 실패.
 */
public interface RetryPolicy {

    /** 첫 시도 포함 최대 시도 수 */
    int maxAttempts();

    boolean shouldRetry(int statusCode, int attempt);

    /**
     * @param failedAttempt 방금 실패한 시도 번호
     * @param retryAfter    서버가 준 Retry-After(없으면 empty)
     */
    Duration delayAfter(int failedAttempt, Optional<Duration> retryAfter);

    /** 429, 5xx, 전송 실패 */
    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || (statusCode >= 500 && statusCode < 600) || statusCode == -1;
    }

    /** 초 단위 Retry-After만 해석. HTTP-date 형태나 음수는 empty */
    static Optional<Duration> parseRetryAfter(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) return Optional.empty();
        try {
            long sec = Long.parseLong(headerValue.trim());
            return sec < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(sec));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
