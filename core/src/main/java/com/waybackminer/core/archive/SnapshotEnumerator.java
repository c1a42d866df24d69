package com.waybackminer.core.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waybackminer.core.api.HarvestDiagnostics;
import com.waybackminer.core.model.FailureKind;
import com.waybackminer.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * URL 하나의 과거 캡처 목록(digest 기준 서로 다른 내용만).
 * 응답 첫 행은 버린다: CDX JSON 출력의 첫 행은 필드 헤더(["timestamp","original"])다.
 */
public class SnapshotEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotEnumerator.class);
    private static final ObjectMapper OM = new ObjectMapper();

    private final ArchiveClient client;
    private final HarvestDiagnostics diagnostics;

    public SnapshotEnumerator(ArchiveClient client, HarvestDiagnostics diagnostics) {
        this.client = Objects.requireNonNull(client, "client");
        this.diagnostics = diagnostics == null ? HarvestDiagnostics.NONE : diagnostics;
    }

    /** 0~1 행이면 빈 목록, N 행이면 N-1 개. 실패는 빈 목록. */
    public List<Snapshot> enumerate(String url, AtomicBoolean cancel) throws InterruptedException {
        String body;
        try {
            body = client.get(client.snapshotsUri(url), cancel);
        } catch (ArchiveException e) {
            LOG.debug("Snapshot query failed for {}: {}", url, e.getMessage());
            diagnostics.onFailure(HarvestDiagnostics.Stage.SNAPSHOTS, url, e.kind(), e);
            return List.of();
        }
        try {
            return parse(body);
        } catch (JsonProcessingException e) {
            LOG.debug("Malformed snapshot list for {}: {}", url, e.getOriginalMessage());
            diagnostics.onFailure(HarvestDiagnostics.Stage.SNAPSHOTS, url, FailureKind.MALFORMED_RESPONSE, e);
            return List.of();
        }
    }

    static List<Snapshot> parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) return List.of();

        JsonNode root = OM.readTree(body);
        if (root == null || !root.isArray()) {
            throw new MalformedSnapshotList("expected a JSON array");
        }
        if (root.size() < 2) return List.of();

        List<Snapshot> out = new ArrayList<>(root.size() - 1);
        for (int i = 1; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (row == null || !row.isArray() || row.size() < 2) continue;
            String ts = row.get(0).asText("");
            String original = row.get(1).asText("");
            if (ts.isEmpty() || original.isEmpty()) continue;
            out.add(new Snapshot(ts, original));
        }
        return out;
    }

    /** 배열이 아닌 JSON(객체 등)을 받은 경우 */
    static final class MalformedSnapshotList extends JsonProcessingException {
        MalformedSnapshotList(String msg) { super(msg); }
    }
}
