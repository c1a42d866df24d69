package com.waybackminer.core.expand;

import com.waybackminer.core.archive.ArchiveClient;
import com.waybackminer.core.archive.ArchiveFixtures;
import com.waybackminer.core.archive.ContentFetcher;
import com.waybackminer.core.archive.SnapshotEnumerator;
import com.waybackminer.core.archive.StubSender;
import com.waybackminer.core.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SourceExpanderTest {

    private static final String PAGE = "https://example.com/about";

    @Test
    void links_from_every_capture_are_merged_in_capture_order() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        Snapshot old = new Snapshot("20050101000000", PAGE);
        Snapshot recent = new Snapshot("20200101000000", PAGE);
        sender.ok(client.snapshotsUri(PAGE), ArchiveFixtures.cdxJson(
                old.timestamp(), PAGE, recent.timestamp(), PAGE));
        sender.ok(client.replayUri(old), "<a href=\"/team\">team</a> <a href=\"http://cdn.other.net/x.js\">");
        sender.ok(client.replayUri(recent), "<a href=\"/team\">team</a> <script src=\"/js/app.js\"></script>");

        SourceExpander ex = new SourceExpander(new SnapshotEnumerator(client, null),
                new ContentFetcher(client), null, "example.com");
        List<String> urls = ex.expand(PAGE, new AtomicBoolean(false)).collect(Collectors.toList());

        assertThat(urls).containsExactly("https://example.com/team", "https://example.com/js/app.js");
        assertThat(ex.sourceSuffix()).isEqualTo(":source");
    }

    @Test
    void empty_capture_body_is_not_a_failure() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        Snapshot s = new Snapshot("20200101000000", PAGE);
        sender.ok(client.snapshotsUri(PAGE), ArchiveFixtures.cdxJson(s.timestamp(), PAGE));
        sender.ok(client.replayUri(s), "");
        List<String> reported = new ArrayList<>();

        SourceExpander ex = new SourceExpander(new SnapshotEnumerator(client, null),
                new ContentFetcher(client), (st, t, k, c) -> reported.add(t), "example.com");

        assertThat(ex.expand(PAGE, new AtomicBoolean(false)).count()).isZero();
        assertThat(reported).isEmpty();
    }
}
