package com.waybackminer.core.expand;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsDirectiveScannerTest {

    private static final URI ROBOTS = URI.create("http://example.com/robots.txt");

    @Test
    void sitemap_allow_disallow_are_resolved_against_origin() {
        String txt = String.join("\n",
                "User-agent: *",
                "Disallow: /admin/   # private area",
                "Allow: /public*",
                "Disallow: /*.php$",
                "Sitemap: https://example.com/sitemap.xml",
                "Crawl-delay: 10",
                "disallow:",
                "Disallow: *");

        List<String> urls = RobotsDirectiveScanner.scan(txt, ROBOTS);

        assertThat(urls).containsExactly(
                "http://example.com/admin/",
                "http://example.com/public",
                "http://example.com/",
                "https://example.com/sitemap.xml");
    }

    @Test
    void keys_are_case_insensitive_and_crlf_is_handled() {
        String txt = "SITEMAP: http://example.com/a.xml\r\nallow: /b\r\nDISALLOW:/c\r\n";

        assertThat(RobotsDirectiveScanner.scan(txt, ROBOTS))
                .containsExactly("http://example.com/a.xml", "http://example.com/b", "http://example.com/c");
    }

    @Test
    void relative_and_protocol_relative_values() {
        String txt = "Allow: page.html\nSitemap: //cdn.example.com/s.xml\n";

        assertThat(RobotsDirectiveScanner.scan(txt, URI.create("https://example.com:8443/robots.txt")))
                .containsExactly("https://example.com:8443/page.html", "https://cdn.example.com/s.xml");
    }

    @Test
    void comment_only_or_non_directive_lines_yield_nothing() {
        String txt = "# Sitemap: http://example.com/hidden.xml\nUser-agent: Googlebot\nHost: example.com\n<html>";

        assertThat(RobotsDirectiveScanner.scan(txt, ROBOTS)).isEmpty();
        assertThat(RobotsDirectiveScanner.scan("", ROBOTS)).isEmpty();
        assertThat(RobotsDirectiveScanner.scan(null, ROBOTS)).isEmpty();
    }

    @Test
    void wildcard_tails_are_trimmed() {
        assertThat(RobotsDirectiveScanner.cleanWildcards("/search*?q=")).isEqualTo("/search");
        assertThat(RobotsDirectiveScanner.cleanWildcards("/end$")).isEqualTo("/end");
        assertThat(RobotsDirectiveScanner.cleanWildcards("*")).isEmpty();
    }
}
