package com.waybackminer.app.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waybackminer.core.model.UrlRecord;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class RecordPrinterTest {

    @Test
    void plain_mode_prints_one_url_per_line_and_drops_repeats() throws Exception {
        StringWriter sw = new StringWriter();
        try (RecordPrinter p = new RecordPrinter(sw, false, false)) {
            assertThat(p.print(new UrlRecord("wayback", "http://example.com/a"))).isTrue();
            assertThat(p.print(new UrlRecord("wayback:source", "http://example.com/a"))).isFalse();
            assertThat(p.print(new UrlRecord("wayback:robots", "http://example.com/b"))).isTrue();
            assertThat(p.printed()).isEqualTo(2);
        }

        assertThat(sw.toString()).isEqualTo("http://example.com/a\nhttp://example.com/b\n");
    }

    @Test
    void json_mode_keeps_first_source_tag() throws Exception {
        StringWriter sw = new StringWriter();
        try (RecordPrinter p = new RecordPrinter(sw, true, true)) {
            p.print(new UrlRecord("wayback:robots", "http://example.com/sitemap.xml"));
            p.print(new UrlRecord("wayback", "http://example.com/sitemap.xml"));
        }

        String[] lines = sw.toString().split("\n");
        assertThat(lines).hasSize(1);
        JsonNode n = new ObjectMapper().readTree(lines[0]);
        assertThat(n.get("source").asText()).isEqualTo("wayback:robots");
        assertThat(n.get("value").asText()).isEqualTo("http://example.com/sitemap.xml");
    }
}
