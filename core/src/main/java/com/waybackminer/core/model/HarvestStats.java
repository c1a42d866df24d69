package com.waybackminer.core.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class HarvestStats {
    private final AtomicLong indexUrls = new AtomicLong(0);        // 인덱스가 돌려준 URL 수
    private final AtomicLong outOfScope = new AtomicLong(0);       // 범위 밖이라 버린 수
    private final Map<String, AtomicLong> emittedBySource = new ConcurrentHashMap<>();
    private final Map<FailureKind, AtomicLong> failures = new EnumMap<>(FailureKind.class);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public HarvestStats() {
        for (FailureKind k : FailureKind.values()) failures.put(k, new AtomicLong(0));
    }

    public void addIndexUrls(long n) { indexUrls.addAndGet(n); }
    public void recordOutOfScope() { outOfScope.incrementAndGet(); }

    public void recordEmitted(String source) {
        emittedBySource.computeIfAbsent(source, s -> new AtomicLong(0)).incrementAndGet();
    }

    public void recordFailure(FailureKind kind) {
        failures.get(kind == null ? FailureKind.UNEXPECTED : kind).incrementAndGet();
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot(long requestsTotal) {
        Map<String, Long> emitted = new LinkedHashMap<>();
        emittedBySource.forEach((k, v) -> emitted.put(k, v.get()));
        Map<FailureKind, Long> fails = new EnumMap<>(FailureKind.class);
        failures.forEach((k, v) -> fails.put(k, v.get()));
        return new Snapshot(requestsTotal, indexUrls.get(), outOfScope.get(),
                Map.copyOf(emitted), Map.copyOf(fails), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long indexUrls;
        public final long outOfScope;
        public final Map<String, Long> emittedBySource;
        public final Map<FailureKind, Long> failures;
        public final int maxObservedConcurrency;

        public Snapshot(long requestsTotal, long indexUrls, long outOfScope,
                        Map<String, Long> emittedBySource, Map<FailureKind, Long> failures,
                        int maxObservedConcurrency) {
            this.requestsTotal = requestsTotal;
            this.indexUrls = indexUrls;
            this.outOfScope = outOfScope;
            this.emittedBySource = emittedBySource;
            this.failures = failures;
            this.maxObservedConcurrency = maxObservedConcurrency;
        }

        public long emittedTotal() {
            return emittedBySource.values().stream().mapToLong(Long::longValue).sum();
        }

        public long failuresTotal() {
            return failures.values().stream().mapToLong(Long::longValue).sum();
        }

        public long failures(FailureKind kind) {
            return failures.getOrDefault(kind, 0L);
        }
    }
}
