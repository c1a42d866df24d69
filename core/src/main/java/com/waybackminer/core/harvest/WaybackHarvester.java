package com.waybackminer.core.harvest;

import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.api.UrlSource;
import com.waybackminer.core.archive.ArchiveClient;
import com.waybackminer.core.archive.ContentFetcher;
import com.waybackminer.core.archive.IndexFetcher;
import com.waybackminer.core.archive.SnapshotEnumerator;
import com.waybackminer.core.expand.Expander;
import com.waybackminer.core.expand.RobotsExpander;
import com.waybackminer.core.expand.SourceExpander;
import com.waybackminer.core.model.FailureKind;
import com.waybackminer.core.model.HarvestConfig;
import com.waybackminer.core.model.HarvestStats;
import com.waybackminer.core.model.ScopeSpec;
import com.waybackminer.core.model.UrlRecord;
import com.waybackminer.core.util.RateLimiter;
import com.waybackminer.core.util.StructuredLog;
import com.waybackminer.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wayback 하베스트 오케스트레이터:
 *  - index → URL 별 작업 단위(범위 판정 → 방출 → 필요 시 확장) → 출력 스트림
 *  - 고정 워커 풀(동시성=concurrency) + 유한 작업 큐, 큐가 차면 생산자가 기다림(역압)
 *  - 전역 RateLimiter 하나를 모든 요청이 공유
 *  - 어떤 로컬 실패도 실행 전체를 멈추지 않음(진단 채널로만 보고)
 */
public final class WaybackHarvester implements UrlSource {

    public static final String NAME = "wayback";

    private static final Logger LOG = LoggerFactory.getLogger(WaybackHarvester.class);
    private static final StructuredLog SLOG = StructuredLog.get(WaybackHarvester.class);

    /** 취소 후 워커 종료 대기 상한 */
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final HarvestConfig config;
    private final HarvestStats stats = new HarvestStats();
    private final ArchiveClient client;
    private final HarvestDiagnostics diagnostics;
    private final AtomicInteger runSeq = new AtomicInteger(0);

    /** 기본 구현: 실제 HttpClient + 분당 requestsPerMinute */
    public WaybackHarvester(HarvestConfig config) {
        this(config, HarvestDiagnostics.NONE);
    }

    public WaybackHarvester(HarvestConfig config, HarvestDiagnostics diagnostics) {
        this(config, diagnostics, null);
    }

    /** DI/테스트용: client 가 null 이면 기본 클라이언트를 만든다. */
    public WaybackHarvester(HarvestConfig config, HarvestDiagnostics diagnostics, ArchiveClient client) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.config = config.copy();
        this.client = (client != null)
                ? client
                : new ArchiveClient(this.config, RateLimiter.perMinute(this.config.getRequestsPerMinute()));

        HarvestDiagnostics counting = (stage, target, kind, cause) -> stats.recordFailure(kind);
        this.diagnostics = counting.andThen(diagnostics);
    }

    @Override
    public String name() { return NAME; }

    /** 실행을 시작하고 곧바로 스트림을 돌려준다. */
    @Override
    public HarvestRun run(String domain) {
        ScopeSpec scope = ScopeSpec.of(domain, config.isIncludeSubdomains());
        HarvestRun run = new HarvestRun(scope.rootDomain(), config.getOutputBuffer());

        int seq = runSeq.incrementAndGet();
        Thread coordinator = new Thread(() -> coordinate(scope, run, seq), "wayback-index-" + seq);
        coordinator.setDaemon(true);
        run.onCancel(coordinator::interrupt);
        coordinator.start();
        return run;
    }

    public HarvestStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot(client.getRequestCount());
    }

    public HarvestConfig getConfig() {
        return config.copy();
    }

    /* =========================
       파이프라인
       ========================= */

    /** 생산자: index 질의 → 작업 제출 → 전원 종료 대기 → 스트림 닫기 */
    private void coordinate(ScopeSpec scope, HarvestRun run, int seq) {
        final AtomicBoolean cancel = run.cancelFlag();
        final long t0 = System.nanoTime();
        final int cc = config.getConcurrency();

        LOG.info("Harvest start: domain={}, subs={}, robots={}, source={}, rpm={}, cc={}",
                scope.rootDomain(), scope.includeSubdomains(), config.isParseRobots(),
                config.isParseSource(), config.getRequestsPerMinute(), cc);
        SLOG.info("harvest-start",
                "domain", scope.rootDomain(),
                "includeSubdomains", scope.includeSubdomains(),
                "parseRobots", config.isParseRobots(),
                "parseSource", config.isParseSource(),
                "rpm", config.getRequestsPerMinute(),
                "cc", cc);

        // 실행마다 확장기 준비(소스 확장기는 도메인을 안다)
        SnapshotEnumerator enumerator = new SnapshotEnumerator(client, diagnostics);
        ContentFetcher fetcher = new ContentFetcher(client);
        Expander robots = new RobotsExpander(enumerator, fetcher, diagnostics);
        Expander source = new SourceExpander(enumerator, fetcher, diagnostics, scope.rootDomain());

        AtomicReference<ExecutorService> execRef = new AtomicReference<>();
        AtomicInteger inFlight = new AtomicInteger(0);
        int submitted = 0;

        try {
            List<String> urls = new IndexFetcher(client, diagnostics).fetch(scope, cancel);
            stats.addIndexUrls(urls.size());
            LOG.debug("Index returned {} urls for {}", urls.size(), scope.queryTarget());

            // ---- 고정 스레드풀(+역압) 구성 ----
            ExecutorService exec = new ThreadPoolExecutor(
                    cc, cc,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(config.getQueueCapacity()),
                    new NamedThreadFactory("wayback-worker-" + seq),
                    (r, e) -> {
                        if (e.isShutdown()) throw new RejectedExecutionException("pool shut down");
                        try { e.getQueue().put(r); }
                        catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                        }
                    }
            );
            execRef.set(exec);
            final Thread self = Thread.currentThread();
            run.onCancel(() -> {
                exec.shutdownNow();
                self.interrupt();
            });
            // onCancel 교체 전에 이미 취소되었을 수 있음
            if (cancel.get()) exec.shutdownNow();

            for (String url : urls) {
                if (cancel.get() || Thread.currentThread().isInterrupted()) break;
                exec.execute(() -> unit(url, scope, run, cancel, robots, source, inFlight));
                submitted++;
            }

            exec.shutdown();
            while (!exec.awaitTermination(1, TimeUnit.SECONDS)) {
                if (cancel.get()) exec.shutdownNow();
            }

        } catch (InterruptedException | CancellationException | RejectedExecutionException stop) {
            LOG.info("Harvest cancelled: domain={}", scope.rootDomain());
            // 이 스레드는 곧 끝난다. 워커 정리를 기다릴 수 있게 인터럽트 상태를 비운다.
            Thread.interrupted();
        } catch (RuntimeException e) {
            LOG.warn("Harvest coordinator failed: {}", e.toString());
            SLOG.error("coordinator-failed", e, "domain", scope.rootDomain());
            diagnostics.onFailure(HarvestDiagnostics.Stage.DISPATCH, scope.rootDomain(), FailureKind.UNEXPECTED, e);
        } finally {
            ExecutorService exec = execRef.get();
            if (exec != null && !exec.isTerminated()) {
                exec.shutdownNow();
                awaitQuietly(exec);
            }
            run.finish();

            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            HarvestStats.Snapshot rt = getRuntimeSnapshot();
            LOG.info("Harvest done. domain={}, submitted={}, emitted={}, failures={}, cancelled={}, {} ms",
                    scope.rootDomain(), submitted, rt.emittedTotal(), rt.failuresTotal(), run.isCancelled(), ms);
            SLOG.info("harvest-done",
                    "domain", scope.rootDomain(),
                    "submitted", submitted,
                    "emitted", rt.emittedTotal(),
                    "failures", rt.failuresTotal(),
                    "requests", rt.requestsTotal,
                    "maxObservedCC", rt.maxObservedConcurrency,
                    "cancelled", run.isCancelled(),
                    "elapsedMs", ms);
        }
    }

    /** 작업 단위 1개: URL 하나를 범위 판정 → 방출 → (조건부) 확장 */
    private void unit(String url, ScopeSpec scope, HarvestRun run, AtomicBoolean cancel,
                      Expander robots, Expander source, AtomicInteger inFlight) {
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        try {
            if (cancel.get()) return;

            if (!scope.contains(url)) {
                stats.recordOutOfScope();
                return;
            }
            if (!emit(run, NAME, url)) return;

            if (!config.isAnyExpansion()) return;
            if (UrlUtils.isMedia(url)) return;

            boolean isRobots = UrlUtils.isRobotsTxt(url);
            Expander expander = null;
            if (isRobots && config.isParseRobots()) expander = robots;
            else if (!isRobots && config.isParseSource()) expander = source;
            if (expander == null) return;

            String tag = NAME + expander.sourceSuffix();
            Iterator<String> found = expander.expand(url, cancel).iterator();
            while (found.hasNext()) {
                String candidate = found.next();
                if (!scope.contains(candidate)) {
                    stats.recordOutOfScope();
                    continue;
                }
                if (!emit(run, tag, candidate)) return;
            }

        } catch (CancellationException ce) {
            // 취소: 조용히 종료
        } catch (RuntimeException e) {
            LOG.warn("Unit failed for {}: {}", url, e.toString());
            SLOG.error("unit-failed", e, "url", url);
            diagnostics.onFailure(HarvestDiagnostics.Stage.DISPATCH, url, FailureKind.UNEXPECTED, e);
        } finally {
            stats.observeConcurrency(inFlight.decrementAndGet());
        }
    }

    private boolean emit(HarvestRun run, String source, String value) {
        if (!run.emit(new UrlRecord(source, value))) return false;
        stats.recordEmitted(source);
        return true;
    }

    private static void awaitQuietly(ExecutorService exec) {
        try {
            if (!exec.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Workers did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
