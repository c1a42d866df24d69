package com.waybackminer.core.expand;

import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.archive.ContentFetcher;
import com.waybackminer.core.archive.SnapshotEnumerator;
import com.waybackminer.core.model.Snapshot;
import com.waybackminer.core.util.UrlUtils;

import java.util.List;

/** 과거 robots.txt 캡처에서 Sitemap/Allow/Disallow 대상 URL 을 뽑는다. */
public final class RobotsExpander extends SnapshotExpander {

    public static final String SUFFIX = ":robots";

    public RobotsExpander(SnapshotEnumerator enumerator, ContentFetcher fetcher, HarvestDiagnostics diagnostics) {
        super(enumerator, fetcher, diagnostics);
    }

    @Override public String sourceSuffix() { return SUFFIX; }

    @Override
    protected List<String> extract(Snapshot snapshot, String content) {
        return RobotsDirectiveScanner.scan(content, UrlUtils.toUri(snapshot.original()));
    }
}
