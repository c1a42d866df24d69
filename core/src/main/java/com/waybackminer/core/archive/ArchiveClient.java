package com.waybackminer.core.archive;

import com.waybackminer.core.model.FailureKind;
import com.waybackminer.core.model.HarvestConfig;
import com.waybackminer.core.model.Snapshot;
import com.waybackminer.core.util.RateLimiter;
import com.waybackminer.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 아카이브 HTTP 접근 창구. 모든 GET 은 여기서 레이트리미터를 거친다.
 * 재시도는 하지 않는다(실패는 호출자가 빈 결과로 흡수).
 */
public class ArchiveClient {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveClient.class);

    /** 취소 플래그 확인 주기 */
    static final long CANCEL_POLL_MS = 100;

    /** 테스트/모킹용 송신 훅. cancel 이 켜지면 진행 중 요청을 중단해야 한다. */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req, AtomicBoolean cancel) throws Exception;
    }

    private final String baseUrl;
    private final Duration timeout;
    private final String userAgent;
    private final RateLimiter limiter;
    private final HttpSender sender;
    private final AtomicLong requests = new AtomicLong(0);

    public ArchiveClient(HarvestConfig config, RateLimiter limiter) {
        this(config, limiter, asyncSender(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build()));
    }

    public ArchiveClient(HarvestConfig config, RateLimiter limiter, HttpSender sender) {
        Objects.requireNonNull(config, "config");
        this.baseUrl = stripTrailingSlash(config.getArchiveBaseUrl());
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    /**
     * sendAsync 로 보내고 짧은 주기로 취소 플래그를 확인한다.
     * 취소/인터럽트 시 진행 중 교환을 cancel 한다.
     */
    public static HttpSender asyncSender(HttpClient client) {
        Objects.requireNonNull(client, "client");
        return (req, cancel) -> {
            CompletableFuture<HttpResponse<String>> f =
                    client.sendAsync(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            for (;;) {
                if (cancel != null && cancel.get()) {
                    f.cancel(true);
                    throw new CancellationException("cancelled: " + req.uri());
                }
                try {
                    return f.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException poll) {
                    // 다음 주기에 취소 여부 재확인
                } catch (InterruptedException ie) {
                    f.cancel(true);
                    throw ie;
                } catch (ExecutionException ee) {
                    Throwable c = ee.getCause();
                    if (c instanceof Exception e) throw e;
                    throw ee;
                }
            }
        };
    }

    // ---------- 엔드포인트 ----------

    /** 평문, urlkey 기준 중복 제거된 original 목록 */
    public URI indexUri(String target) {
        return URI.create(baseUrl + "/cdx/search/cdx?url=" + enc(target + "/*")
                + "&output=txt&fl=original&collapse=urlkey");
    }

    /** JSON, digest 기준 중복 제거된 [timestamp, original] 목록 */
    public URI snapshotsUri(String url) {
        return URI.create(baseUrl + "/cdx/search/cdx?url=" + enc(url)
                + "&output=json&fl=timestamp,original&collapse=digest");
    }

    /** if_ (frame-free) 재생: 아카이브 툴바 없이 원본 바이트 */
    public URI replayUri(Snapshot snapshot) throws ArchiveException {
        String raw = baseUrl + "/web/" + snapshot.timestamp() + "if_/" + snapshot.original();
        URI u = UrlUtils.toUri(raw);
        if (u == null || u.getHost() == null) {
            throw new ArchiveException(FailureKind.MALFORMED_RESPONSE, raw, "unusable snapshot url");
        }
        return u;
    }

    // ---------- 요청 ----------

    /**
     * 레이트리미터를 거쳐 GET. 2xx 가 아니면 HTTP_STATUS, 전송 오류면 TRANSPORT.
     * 취소되면 CancellationException, 인터럽트되면 InterruptedException 을 그대로 던진다.
     */
    public String get(URI uri, AtomicBoolean cancel) throws ArchiveException, InterruptedException {
        checkCancel(cancel);
        limiter.acquire();
        checkCancel(cancel);

        requests.incrementAndGet();
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();

        long t0 = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = sender.send(req, cancel);
        } catch (InterruptedException | CancellationException stop) {
            throw stop;
        } catch (Exception e) {
            throw new ArchiveException(FailureKind.TRANSPORT, uri.toString(), e.toString(), e);
        }
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        int code = resp.statusCode();
        LOG.debug("GET {} -> {} ({} ms)", uri, code, ms);
        if (code < 200 || code >= 300) {
            throw new ArchiveException(FailureKind.HTTP_STATUS, uri.toString(), "HTTP " + code);
        }
        return resp.body() == null ? "" : resp.body();
    }

    public long getRequestCount() {
        return requests.get();
    }

    private static void checkCancel(AtomicBoolean cancel) {
        if (cancel != null && cancel.get()) throw new CancellationException();
        if (Thread.currentThread().isInterrupted()) throw new CancellationException("interrupted");
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String s) {
        String r = Objects.requireNonNull(s, "archiveBaseUrl").trim();
        while (r.endsWith("/")) r = r.substring(0, r.length() - 1);
        return r;
    }
}
