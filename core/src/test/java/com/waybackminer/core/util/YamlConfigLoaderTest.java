package com.waybackminer.core.util;

import com.waybackminer.core.model.HarvestConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir
    Path dir;

    private static HarvestConfig fromString(String yaml) {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void full_file_maps_every_key() throws Exception {
        Path p = dir.resolve("wayback.yml");
        Files.writeString(p, String.join("\n",
                "includeSubdomains: true",
                "parseRobots: true",
                "parseSource: false",
                "requestsPerMinute: 15",
                "concurrency: 3",
                "queueCapacity: 9",
                "outputBuffer: 64",
                "timeoutMs: 2500",
                "archive:",
                "  baseUrl: \"http://localhost:18080\"",
                "  userAgent: \"my-agent/1.0\"",
                ""));

        HarvestConfig cfg = YamlConfigLoader.load(p);

        assertThat(cfg.isIncludeSubdomains()).isTrue();
        assertThat(cfg.isParseRobots()).isTrue();
        assertThat(cfg.isParseSource()).isFalse();
        assertThat(cfg.getRequestsPerMinute()).isEqualTo(15);
        assertThat(cfg.getConcurrency()).isEqualTo(3);
        assertThat(cfg.getQueueCapacity()).isEqualTo(9);
        assertThat(cfg.getOutputBuffer()).isEqualTo(64);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.getArchiveBaseUrl()).isEqualTo("http://localhost:18080");
        assertThat(cfg.getUserAgent()).isEqualTo("my-agent/1.0");
    }

    @Test
    void bundled_example_matches_defaults_except_robots() throws Exception {
        HarvestConfig cfg;
        try (InputStream in = YamlConfigLoaderTest.class.getResourceAsStream("/wayback.yml")) {
            assertThat(in).isNotNull();
            cfg = YamlConfigLoader.load(in);
        }

        assertThat(cfg.isParseRobots()).isTrue();
        assertThat(cfg.getConcurrency()).isEqualTo(HarvestConfig.defaults().getConcurrency());
        assertThat(cfg.getUserAgent()).isEqualTo(HarvestConfig.DEFAULT_USER_AGENT);
    }

    @Test
    void missing_keys_keep_defaults() {
        HarvestConfig cfg = fromString("parseSource: true\n");

        assertThat(cfg.isParseSource()).isTrue();
        assertThat(cfg.getRequestsPerMinute()).isEqualTo(40);
        assertThat(cfg.getConcurrency()).isEqualTo(8);
        assertThat(cfg.getArchiveBaseUrl()).isEqualTo(HarvestConfig.DEFAULT_ARCHIVE_URL);
    }

    @Test
    void empty_document_is_all_defaults() {
        HarvestConfig cfg = fromString("");
        assertThat(cfg.getConcurrency()).isEqualTo(8);
        assertThat(cfg.isAnyExpansion()).isFalse();
    }

    @Test
    void quoted_numbers_are_accepted() {
        assertThat(fromString("concurrency: \"5\"\n").getConcurrency()).isEqualTo(5);
    }

    @Test
    void non_integer_is_rejected_with_key_name() {
        assertThatThrownBy(() -> fromString("requestsPerMinute: lots\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestsPerMinute");
    }

    @Test
    void invalid_values_fail_validation() {
        assertThatThrownBy(() -> fromString("concurrency: 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> fromString("timeoutMs: 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeoutMs");
    }

    @Test
    void malformed_yaml_is_rejected_with_file_name() throws Exception {
        Path p = dir.resolve("broken.yml");
        Files.writeString(p, "parseRobots: [true\nconcurrency: {\n");

        assertThatThrownBy(() -> YamlConfigLoader.load(p))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("malformed YAML")
                .hasMessageContaining("broken.yml");
    }

    @Test
    void missing_file_is_an_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("config not found");
    }
}
