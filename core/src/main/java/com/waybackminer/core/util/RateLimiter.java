package com.waybackminer.core.util;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 토큰 버킷. 하베스터 하나당 인스턴스 하나를 모든 요청 경로가 공유한다.
 * 공정성은 보장하지 않고 전체 요청률 상한만 지킨다.
 */
public final class RateLimiter {
    private final long capacity;
    private final double refillPerNano;
    private final LongSupplier clock;
    private double tokens;
    private long lastNs;

    /** capacity 만큼 버스트, 이후 분당 refillPerMinute 개씩 보충 */
    public RateLimiter(long capacity, long refillPerMinute) {
        this(capacity, refillPerMinute, System::nanoTime);
    }

    RateLimiter(long capacity, long refillPerMinute, LongSupplier clock) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (refillPerMinute < 1) throw new IllegalArgumentException("refillPerMinute must be >= 1");
        this.capacity = capacity;
        this.refillPerNano = refillPerMinute / (double) TimeUnit.MINUTES.toNanos(1);
        this.clock = clock;
        this.tokens = capacity;
        this.lastNs = clock.getAsLong();
    }

    /** 버스트 1, 분당 rpm. 아카이브 기본값은 perMinute(40). */
    public static RateLimiter perMinute(int rpm) {
        return new RateLimiter(1, rpm);
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            long waitMs = Math.max(1, (long) Math.ceil((1.0 - tokens) / refillPerNano / 1_000_000.0));
            this.wait(Math.min(waitMs, 250));
        }
    }

    /** 대기 없이 토큰을 얻을 수 있으면 소비하고 true */
    synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = clock.getAsLong();
        double add = (now - lastNs) * refillPerNano;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
