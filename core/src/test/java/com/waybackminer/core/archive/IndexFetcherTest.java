package com.waybackminer.core.archive;

import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.model.FailureKind;
import com.waybackminer.core.model.ScopeSpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class IndexFetcherTest {

    private final List<FailureKind> reported = new ArrayList<>();
    private final HarvestDiagnostics diag = (stage, target, kind, cause) -> reported.add(kind);

    @Test
    void blank_lines_are_dropped_and_archive_order_kept() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.ok(client.indexUri("example.com"),
                "http://example.com/b\n\nhttp://example.com/a\r\n   \nhttp://sub.example.com/c\n");

        List<String> urls = new IndexFetcher(client, diag)
                .fetch(ScopeSpec.of("example.com", false), new AtomicBoolean(false));

        assertThat(urls).containsExactly("http://example.com/b", "http://example.com/a", "http://sub.example.com/c");
        assertThat(reported).isEmpty();
    }

    @Test
    void subdomain_scope_queries_the_wildcard_target() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.ok(client.indexUri("*.example.com"), "http://www.example.com/\n");

        List<String> urls = new IndexFetcher(client, diag)
                .fetch(ScopeSpec.of("example.com", true), new AtomicBoolean(false));

        assertThat(urls).containsExactly("http://www.example.com/");
        assertThat(sender.requested(client.indexUri("*.example.com"))).isTrue();
    }

    @Test
    void transport_failure_yields_empty_list_and_is_reported() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.fail(client.indexUri("example.com"), "connection reset");

        List<String> urls = new IndexFetcher(client, diag)
                .fetch(ScopeSpec.of("example.com", false), new AtomicBoolean(false));

        assertThat(urls).isEmpty();
        assertThat(reported).containsExactly(FailureKind.TRANSPORT);
    }

    @Test
    void error_status_yields_empty_list() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.status(client.indexUri("example.com"), 429);

        List<String> urls = new IndexFetcher(client, diag)
                .fetch(ScopeSpec.of("example.com", false), new AtomicBoolean(false));

        assertThat(urls).isEmpty();
        assertThat(reported).containsExactly(FailureKind.HTTP_STATUS);
    }

    @Test
    void empty_body_is_an_empty_index() {
        assertThat(IndexFetcher.parseLines("")).isEmpty();
        assertThat(IndexFetcher.parseLines(null)).isEmpty();
    }
}
