package com.waybackminer.core.expand;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceLinkPatternsTest {

    private static final URI BASE = URI.create("http://example.com/index.html");

    @Test
    void absolute_protocol_relative_and_root_relative_links() {
        String html = """
            <html><body>
              <a href="https://example.com/a?x=1">A</a>
              <script src="//static.example.com/app.js"></script>
              <img src="/img/logo.png">
              <script>var u = "https:\\/\\/api.example.com\\/v1\\/users";</script>
              <a href="http://other.org/x">other</a>
              <p>see http://example.com/docs.</p>
              <a href='/login'>login</a>
            </body></html>
            """;

        List<String> urls = SourceLinkPatterns.extract(html, BASE, "example.com");

        assertThat(urls).containsExactlyInAnyOrder(
                "https://example.com/a?x=1",
                "https://api.example.com/v1/users",
                "http://example.com/docs",
                "http://static.example.com/app.js",
                "http://example.com/img/logo.png",
                "http://example.com/login");
    }

    @Test
    void foreign_hosts_and_lookalikes_are_dropped() {
        String js = "fetch('https://badexample.com/x'); load('https://example.com.evil.org/y');";

        assertThat(SourceLinkPatterns.extract(js, BASE, "example.com")).isEmpty();
    }

    @Test
    void protocol_relative_inherits_capture_scheme() {
        String html = "<link href=\"//example.com/style.css\">";

        assertThat(SourceLinkPatterns.extract(html, URI.create("https://example.com/"), "example.com"))
                .containsExactly("https://example.com/style.css");
    }

    @Test
    void root_relative_needs_a_base() {
        assertThat(SourceLinkPatterns.extract("<a href=\"/only-relative\">", null, "example.com")).isEmpty();
    }

    @Test
    void duplicates_collapse_within_one_document() {
        String html = "<a href=\"http://example.com/a\"></a><a href=\"http://example.com/a\"></a>";

        assertThat(SourceLinkPatterns.extract(html, BASE, "example.com")).containsExactly("http://example.com/a");
    }

    @Test
    void archive_rewritten_links_are_unwrapped_to_the_original_url() {
        String html = "<a href=\"/web/20150101000000/http://example.com/contact\">c</a>"
                + "<a href=\"https://web.archive.org/web/20150101000000if_/http://example.com/about\">a</a>"
                + "<img src=\"//web.archive.org/web/20150101000000im_/https://cdn.example.com/logo.png\">";

        List<String> urls = SourceLinkPatterns.extract(html, BASE, "example.com");

        assertThat(urls).containsExactlyInAnyOrder(
                "http://example.com/contact",
                "http://example.com/about",
                "https://cdn.example.com/logo.png");
        assertThat(urls).noneMatch(u -> u.contains("/web/2015"));
    }

    @Test
    void web_paths_without_a_wrapped_url_stay_root_relative() {
        assertThat(SourceLinkPatterns.extract("<a href=\"/web/2015/news\">", BASE, "example.com"))
                .containsExactly("http://example.com/web/2015/news");
    }

    @Test
    void trailing_punctuation_is_trimmed() {
        assertThat(SourceLinkPatterns.trimTrailing("http://example.com/x).,")).isEqualTo("http://example.com/x");
        assertThat(SourceLinkPatterns.trimTrailing("http://example.com/x")).isEqualTo("http://example.com/x");
    }
}
