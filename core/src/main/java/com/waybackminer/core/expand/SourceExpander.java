package com.waybackminer.core.expand;

import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.archive.ContentFetcher;
import com.waybackminer.core.archive.SnapshotEnumerator;
import com.waybackminer.core.model.Snapshot;
import com.waybackminer.core.util.UrlUtils;

import java.util.List;
import java.util.Objects;

/** 과거 페이지 캡처 본문에서 같은 도메인의 URL 모양 문자열을 뽑는다. */
public final class SourceExpander extends SnapshotExpander {

    public static final String SUFFIX = ":source";

    private final String rootDomain;

    public SourceExpander(SnapshotEnumerator enumerator, ContentFetcher fetcher,
                          HarvestDiagnostics diagnostics, String rootDomain) {
        super(enumerator, fetcher, diagnostics);
        this.rootDomain = Objects.requireNonNull(rootDomain, "rootDomain");
    }

    @Override public String sourceSuffix() { return SUFFIX; }

    @Override
    protected List<String> extract(Snapshot snapshot, String content) {
        return SourceLinkPatterns.extract(content, UrlUtils.toUri(snapshot.original()), rootDomain);
    }
}
