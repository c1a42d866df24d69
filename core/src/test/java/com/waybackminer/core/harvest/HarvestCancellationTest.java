package com.waybackminer.core.harvest;

import com.waybackminer.core.archive.ArchiveClient;
import com.waybackminer.core.archive.ArchiveFixtures;
import com.waybackminer.core.archive.StubSender;
import com.waybackminer.core.model.UrlRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestCancellationTest {

    private static String manyUrls(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) sb.append("http://example.com/p").append(i).append('\n');
        return sb.toString();
    }

    @Test
    void cancel_with_full_undrained_buffer_still_finishes() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.ok(client.indexUri("example.com"), manyUrls(200));

        WaybackHarvester h = new WaybackHarvester(
                ArchiveFixtures.config().setConcurrency(2).setQueueCapacity(2).setOutputBuffer(1), null, client);
        HarvestRun run = h.run("example.com");

        // 아무도 읽지 않으니 워커와 제출자가 모두 막힌다
        Thread.sleep(300);
        assertThat(run.isFinished()).isFalse();

        run.cancel();

        assertThat(run.awaitCompletion(Duration.ofSeconds(3))).isTrue();
        assertThat(run.isCancelled()).isTrue();
        assertThat(run.iterator().hasNext()).isFalse();
    }

    @Test
    void cancel_during_in_flight_index_query_returns_promptly() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.slow(client.indexUri("example.com"), manyUrls(5), Duration.ofSeconds(30));

        HarvestRun run = new WaybackHarvester(ArchiveFixtures.config(), null, client).run("example.com");
        Thread.sleep(100);

        long t0 = System.nanoTime();
        run.cancel();

        assertThat(run.awaitCompletion(Duration.ofSeconds(2))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    void cancel_during_slow_expansion_stops_workers() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.slow(client.indexUri("example.com"), manyUrls(20), Duration.ZERO);
        sender.delayAll(Duration.ofSeconds(30)); // 인덱스 외 조회는 모두 느림

        HarvestRun run = new WaybackHarvester(
                ArchiveFixtures.config().setConcurrency(4).setParseSource(true), null, client).run("example.com");

        Iterator<UrlRecord> it = run.iterator();
        assertThat(it.hasNext()).isTrue(); // 방출은 확장 전에 일어난다
        it.next();

        run.cancel();
        assertThat(run.awaitCompletion(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    void closing_a_partially_read_stream_cancels_the_run() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.ok(client.indexUri("example.com"), manyUrls(100));

        HarvestRun run = new WaybackHarvester(
                ArchiveFixtures.config().setConcurrency(2).setOutputBuffer(4), null, client).run("example.com");

        List<UrlRecord> firstThree;
        try (Stream<UrlRecord> s = run.stream()) {
            firstThree = s.limit(3).collect(Collectors.toList());
        }

        assertThat(firstThree).hasSize(3);
        assertThat(run.isCancelled()).isTrue();
        assertThat(run.awaitCompletion(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    void close_after_full_read_is_harmless() throws Exception {
        StubSender sender = new StubSender();
        ArchiveClient client = ArchiveFixtures.client(sender);
        sender.ok(client.indexUri("example.com"), manyUrls(3));

        HarvestRun run = new WaybackHarvester(ArchiveFixtures.config(), null, client).run("example.com");
        long n;
        try (Stream<UrlRecord> s = run.stream()) {
            n = s.count();
        }

        assertThat(n).isEqualTo(3);
        assertThat(run.isCancelled()).isFalse();
        assertThat(run.isFinished()).isTrue();
    }
}
