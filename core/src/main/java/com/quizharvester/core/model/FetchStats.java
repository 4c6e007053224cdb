package com.quizharvester.core.model;

import java.util.concurrent.atomic.AtomicLong;

/** Fetcher 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class FetchStats {
    private final AtomicLong networkCalls = new AtomicLong(0); // 실제 송신(재시도 포함) 총합
    private final AtomicLong retriesTotal = new AtomicLong(0);
    private final AtomicLong cacheHits    = new AtomicLong(0);
    private final AtomicLong failures     = new AtomicLong(0); // 최종 실패(fetch 단위)

    public void addNetworkCall() { networkCalls.incrementAndGet(); }
    public void addRetries(long n) { retriesTotal.addAndGet(n); }
    public void addCacheHit() { cacheHits.incrementAndGet(); }
    public void addFailure() { failures.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(networkCalls.get(), retriesTotal.get(), cacheHits.get(), failures.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long networkCalls;
        public final long retriesTotal;
        public final long cacheHits;
        public final long failures;
        public Snapshot(long n, long r, long h, long f) {
            this.networkCalls = n;
            this.retriesTotal = r;
            this.cacheHits = h;
            this.failures = f;
        }
    }
}
