package com.quizharvester.core.http;

import com.quizharvester.core.util.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 직전 네트워크 호출 시작 시점부터 최소 간격을 보장하는 스로틀.
 * 페처 인스턴스 하나에 시계 하나(URL/세션 구분 없음).
 */
public final class MinIntervalThrottle {
    private final long intervalNanos;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private long lastStartNanos;
    private boolean started;

    public MinIntervalThrottle(Duration interval, Sleeper sleeper) {
        this(interval, sleeper, System::nanoTime);
    }

    public MinIntervalThrottle(Duration interval, Sleeper sleeper, LongSupplier nanoClock) {
        Objects.requireNonNull(interval, "interval");
        this.intervalNanos = Math.max(0L, interval.toNanos());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /** 필요한 만큼 대기한 뒤 이번 호출 시작 시점을 기록한다. 실제 대기한 시간을 반환. */
    public synchronized Duration acquire() throws InterruptedException {
        Duration waited = Duration.ZERO;
        if (started && intervalNanos > 0) {
            long elapsed = nanoClock.getAsLong() - lastStartNanos;
            long remaining = intervalNanos - elapsed;
            if (remaining > 0) {
                waited = Duration.ofNanos(remaining);
                sleeper.sleep(waited);
            }
        }
        lastStartNanos = nanoClock.getAsLong();
        started = true;
        return waited;
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }
}
