package com.waybackminer.core.util;

import com.waybackminer.core.model.HarvestConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * wayback.yml 을 읽어 HarvestConfig 로 변환.
 *
 * 예상 YAML 키:
 * includeSubdomains: false
 * parseRobots: true
 * parseSource: false
 * requestsPerMinute: 40
 * concurrency: 8
 * queueCapacity: 16
 * outputBuffer: 1024
 * timeoutMs: 30000
 * archive:
 *   baseUrl: "https://web.archive.org"
 *   userAgent: "WaybackMiner/0.1"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "wayback.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 wayback.yml, 없으면 기본값 */
    public static HarvestConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        return Files.exists(p) ? load(p) : HarvestConfig.defaults();
    }

    public static HarvestConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in, yamlPath.toString());
        }
    }

    public static HarvestConfig load(InputStream in) {
        return load(in, "<stream>");
    }

    /** 문법 오류는 IllegalArgumentException 으로 바꿔 올린다 (source 는 메시지용) */
    private static HarvestConfig load(InputStream in, String source) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed YAML in " + source + ": " + e.getMessage(), e);
        }

        HarvestConfig cfg = HarvestConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setBoolean(map, "includeSubdomains", cfg::setIncludeSubdomains);
        setBoolean(map, "parseRobots", cfg::setParseRobots);
        setBoolean(map, "parseSource", cfg::setParseSource);
        setInt(map, "requestsPerMinute", cfg::setRequestsPerMinute);
        setInt(map, "concurrency", cfg::setConcurrency);
        setInt(map, "queueCapacity", cfg::setQueueCapacity);
        setInt(map, "outputBuffer", cfg::setOutputBuffer);
        setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);

        // 2) archive.*
        Map<?, ?> archive = getMap(map, "archive");
        if (archive != null) {
            setString(archive, "baseUrl", cfg::setArchiveBaseUrl);
            setString(archive, "userAgent", cfg::setUserAgent);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v).trim());
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms;
        try {
            ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
        if (ms <= 0) throw new IllegalArgumentException(key + " must be > 0");
        setter.accept(Duration.ofMillis(ms));
    }
}
