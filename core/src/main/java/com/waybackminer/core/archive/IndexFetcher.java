package com.waybackminer.core.archive;

import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.model.ScopeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** CDX 인덱스 1회 질의: 도메인에 대해 아카이브가 아는 모든 URL. */
public class IndexFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(IndexFetcher.class);

    private final ArchiveClient client;
    private final HarvestDiagnostics diagnostics;

    public IndexFetcher(ArchiveClient client, HarvestDiagnostics diagnostics) {
        this.client = Objects.requireNonNull(client, "client");
        this.diagnostics = diagnostics == null ? HarvestDiagnostics.NONE : diagnostics;
    }

    /**
     * 빈 줄을 버린 URL 목록(아카이브 순서). 실패하면 빈 목록이고 예외는 호출자에게 가지 않는다.
     * 취소/인터럽트만 예외로 전파된다.
     */
    public List<String> fetch(ScopeSpec scope, AtomicBoolean cancel) throws InterruptedException {
        String target = scope.queryTarget();
        String body;
        try {
            body = client.get(client.indexUri(target), cancel);
        } catch (ArchiveException e) {
            LOG.warn("Index query failed for {}: {}", target, e.getMessage());
            diagnostics.onFailure(HarvestDiagnostics.Stage.INDEX, target, e.kind(), e);
            return List.of();
        }
        return parseLines(body);
    }

    static List<String> parseLines(String body) {
        List<String> out = new ArrayList<>();
        if (body == null || body.isEmpty()) return out;
        try (BufferedReader r = new BufferedReader(new StringReader(body))) {
            String line;
            while ((line = r.readLine()) != null) {
                String url = line.trim();
                if (url.isEmpty()) continue;
                out.add(url);
            }
        } catch (IOException e) {
            // StringReader 는 IOException 을 내지 않지만 계약상 처리
            throw new IllegalStateException(e);
        }
        return out;
    }
}
