package com.waybackminer.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 하베스트 설정 (wayback.yml 매핑 대상). 순수 설정 보관용.
 * 실행이 시작되면 하베스터는 {@link #copy()} 로 떼어낸 사본만 읽는다.
 */
public final class HarvestConfig {

    public static final String DEFAULT_ARCHIVE_URL = "https://web.archive.org";
    public static final String DEFAULT_USER_AGENT = "WaybackMiner/0.1";

    // ---------- 확장 스위치 ----------
    private boolean includeSubdomains = false;
    private boolean parseRobots = false;
    private boolean parseSource = false;

    // ---------- 런타임 ----------
    private int requestsPerMinute = 40;   // 아카이브 전체 요청 상한
    private int concurrency = 8;          // 워커 풀 크기
    private int queueCapacity = -1;       // 대기 작업 상한(-1 이면 concurrency*2)
    private int outputBuffer = 1024;      // 출력 스트림 버퍼
    private Duration timeout = Duration.ofSeconds(30); // 요청 타임아웃

    // ---------- 아카이브 ----------
    private String archiveBaseUrl = DEFAULT_ARCHIVE_URL;
    private String userAgent = DEFAULT_USER_AGENT;

    // ---------- getters ----------
    public boolean isIncludeSubdomains() { return includeSubdomains; }
    public boolean isParseRobots() { return parseRobots; }
    public boolean isParseSource() { return parseSource; }
    public int getRequestsPerMinute() { return requestsPerMinute; }
    public int getConcurrency() { return concurrency; }
    public int getOutputBuffer() { return outputBuffer; }
    public Duration getTimeout() { return timeout; }
    public String getArchiveBaseUrl() { return archiveBaseUrl; }
    public String getUserAgent() { return userAgent; }

    /** 미설정이면 concurrency*2 */
    public int getQueueCapacity() {
        return queueCapacity > 0 ? queueCapacity : Math.max(1, concurrency * 2);
    }

    /** 둘 중 하나라도 켜져 있으면 아카이브 본문까지 내려받는다. */
    public boolean isAnyExpansion() { return parseRobots || parseSource; }

    // ---------- fluent setters ----------
    public HarvestConfig setIncludeSubdomains(boolean v) { this.includeSubdomains = v; return this; }
    public HarvestConfig setParseRobots(boolean v) { this.parseRobots = v; return this; }
    public HarvestConfig setParseSource(boolean v) { this.parseSource = v; return this; }
    public HarvestConfig setRequestsPerMinute(int v) { this.requestsPerMinute = v; return this; }
    public HarvestConfig setConcurrency(int v) { this.concurrency = v; return this; }
    public HarvestConfig setQueueCapacity(int v) { this.queueCapacity = v; return this; }
    public HarvestConfig setOutputBuffer(int v) { this.outputBuffer = v; return this; }
    public HarvestConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public HarvestConfig setArchiveBaseUrl(String url) { this.archiveBaseUrl = url; return this; }
    public HarvestConfig setUserAgent(String ua) { this.userAgent = ua; return this; }

    public HarvestConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public long getTimeoutMs() { return timeout.toMillis(); }

    // ---------- validate ----------
    public void validate() {
        if (requestsPerMinute <= 0) throw new IllegalArgumentException("requestsPerMinute must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (queueCapacity == 0 || queueCapacity < -1)
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        if (outputBuffer < 1) throw new IllegalArgumentException("outputBuffer must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(archiveBaseUrl, "archiveBaseUrl");
        if (!archiveBaseUrl.startsWith("http://") && !archiveBaseUrl.startsWith("https://"))
            throw new IllegalArgumentException("archiveBaseUrl must be an http(s) URL: " + archiveBaseUrl);
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
    }

    // ---------- helpers ----------
    public static HarvestConfig defaults() { return new HarvestConfig(); }

    public HarvestConfig copy() {
        HarvestConfig c = new HarvestConfig();
        c.includeSubdomains = includeSubdomains;
        c.parseRobots = parseRobots;
        c.parseSource = parseSource;
        c.requestsPerMinute = requestsPerMinute;
        c.concurrency = concurrency;
        c.queueCapacity = queueCapacity;
        c.outputBuffer = outputBuffer;
        c.timeout = timeout;
        c.archiveBaseUrl = archiveBaseUrl;
        c.userAgent = userAgent;
        return c;
    }

    @Override public String toString() {
        return "HarvestConfig{subs=" + includeSubdomains
                + ", robots=" + parseRobots
                + ", source=" + parseSource
                + ", rpm=" + requestsPerMinute
                + ", cc=" + concurrency
                + ", queue=" + getQueueCapacity()
                + ", buffer=" + outputBuffer
                + ", timeoutMs=" + getTimeoutMs()
                + ", archive=" + archiveBaseUrl + "}";
    }
}
