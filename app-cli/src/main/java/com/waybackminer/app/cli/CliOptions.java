package com.waybackminer.app.cli;

import com.waybackminer.core.model.HarvestConfig;

import java.nio.file.Path;

/**
 * 명령행 인자. 지정된 플래그만 설정 파일 값을 덮어쓴다.
 */
public final class CliOptions {

    public static final String USAGE = """
            Usage: waybackminer -d <domain> [options]

            Options:
              -d, --domain DOMAIN       Target domain (required)
              --include-subdomains      Also harvest *.DOMAIN
              --parse-robots            Mine historical robots.txt captures for more URLs
              --parse-source            Mine archived page content for more URLs
              --config FILE             YAML config (default: ./wayback.yml if present)
              --json                    Print JSON lines {"source":..,"value":..}
              --rpm N                   Archive requests per minute (default 40)
              --concurrency N           Worker threads (default 8)
              --timeout-ms N            Per-request timeout in milliseconds
              --archive-url URL         Archive base URL (default https://web.archive.org)
              --limit N                 Stop after N unique URLs
              -o, --output FILE         Write results to FILE instead of stdout
              -h, --help                Show this help
            """;

    private String domain;
    private boolean includeSubdomains;
    private boolean parseRobots;
    private boolean parseSource;
    private boolean json;
    private boolean help;
    private Path config;
    private Integer requestsPerMinute;
    private Integer concurrency;
    private Long timeoutMs;
    private String archiveUrl;
    private long limit = -1;   // -1: 제한 없음
    private Path output;

    private CliOptions() {}

    public static CliOptions parse(String... args) throws UsageException {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            try {
                switch (arg) {
                    case "-h", "--help" -> o.help = true;
                    case "-d", "--domain" -> o.domain = args[++i];
                    case "--include-subdomains" -> o.includeSubdomains = true;
                    case "--parse-robots" -> o.parseRobots = true;
                    case "--parse-source" -> o.parseSource = true;
                    case "--json" -> o.json = true;
                    case "--config" -> o.config = Path.of(args[++i]);
                    case "--rpm" -> o.requestsPerMinute = positiveInt(arg, args[++i]);
                    case "--concurrency" -> o.concurrency = positiveInt(arg, args[++i]);
                    case "--timeout-ms" -> o.timeoutMs = (long) positiveInt(arg, args[++i]);
                    case "--archive-url" -> o.archiveUrl = args[++i];
                    case "--limit" -> o.limit = positiveInt(arg, args[++i]);
                    case "-o", "--output" -> o.output = Path.of(args[++i]);
                    default -> throw new UsageException("unknown option " + arg);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                throw new UsageException("missing value for option " + arg);
            }
        }
        if (!o.help && (o.domain == null || o.domain.isBlank())) {
            throw new UsageException("missing required option -d <domain>");
        }
        return o;
    }

    private static int positiveInt(String option, String value) throws UsageException {
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("invalid number for option " + option + ": " + value);
        }
        if (n < 1) throw new UsageException(option + " must be >= 1");
        return n;
    }

    /** 설정 파일(또는 기본값) 위에 명령행 값을 얹는다. base 는 바뀌지 않는다. */
    public HarvestConfig applyTo(HarvestConfig base) {
        HarvestConfig c = base.copy();
        if (includeSubdomains) c.setIncludeSubdomains(true);
        if (parseRobots) c.setParseRobots(true);
        if (parseSource) c.setParseSource(true);
        if (requestsPerMinute != null) c.setRequestsPerMinute(requestsPerMinute);
        if (concurrency != null) c.setConcurrency(concurrency);
        if (timeoutMs != null) c.setTimeoutMs(timeoutMs);
        if (archiveUrl != null) c.setArchiveBaseUrl(archiveUrl.trim());
        return c;
    }

    public String domain() { return domain; }
    public boolean json() { return json; }
    public boolean help() { return help; }
    public Path config() { return config; }
    public long limit() { return limit; }
    public boolean hasLimit() { return limit > 0; }
    public Path output() { return output; }
}
