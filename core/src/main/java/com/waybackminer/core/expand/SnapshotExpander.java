package com.waybackminer.core.expand;

import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.archive.ArchiveException;
import com.waybackminer.core.archive.ContentFetcher;
import com.waybackminer.core.archive.SnapshotEnumerator;
import com.waybackminer.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 공통 루프: 캡처 목록 → 캡처별 내용 → extract().
 * 캡처 하나의 실패는 그 캡처만 건너뛴다. 한 번의 expand 안에서 같은 URL 은 한 번만 나온다.
 */
public abstract class SnapshotExpander implements Expander {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotExpander.class);

    private final SnapshotEnumerator enumerator;
    private final ContentFetcher fetcher;
    private final HarvestDiagnostics diagnostics;

    protected SnapshotExpander(SnapshotEnumerator enumerator, ContentFetcher fetcher, HarvestDiagnostics diagnostics) {
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.diagnostics = diagnostics == null ? HarvestDiagnostics.NONE : diagnostics;
    }

    @Override
    public final Stream<String> expand(String url, AtomicBoolean cancel) {
        Iterator<String> lazy = new Iterator<>() {
            private Iterator<Snapshot> snapshots;   // 첫 hasNext() 에서 조회
            private Iterator<String> current = Collections.emptyIterator();

            @Override public boolean hasNext() {
                while (!current.hasNext()) {
                    if (snapshots == null) snapshots = snapshotsOf(url, cancel).iterator();
                    if (!snapshots.hasNext()) return false;
                    current = extractFrom(snapshots.next(), cancel).iterator();
                }
                return true;
            }

            @Override public String next() {
                if (!hasNext()) throw new NoSuchElementException();
                return current.next();
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(lazy, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .distinct();
    }

    /** 캡처 원본 내용에서 후보 URL 추출(절대 URL 로 해석된 상태여야 함) */
    protected abstract List<String> extract(Snapshot snapshot, String content);

    private List<Snapshot> snapshotsOf(String url, AtomicBoolean cancel) {
        try {
            return enumerator.enumerate(url, cancel);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while listing snapshots of " + url);
        }
    }

    private List<String> extractFrom(Snapshot snapshot, AtomicBoolean cancel) {
        String content;
        try {
            content = fetcher.fetch(snapshot, cancel);
        } catch (ArchiveException e) {
            LOG.debug("Skip snapshot {} {}: {}", snapshot.timestamp(), snapshot.original(), e.getMessage());
            diagnostics.onFailure(HarvestDiagnostics.Stage.CONTENT,
                    snapshot.timestamp() + "/" + snapshot.original(), e.kind(), e);
            return List.of();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while fetching " + snapshot.original());
        }
        if (content.isEmpty()) return List.of();
        return extract(snapshot, content);
    }
}
