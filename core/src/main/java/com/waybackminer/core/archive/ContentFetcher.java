package com.waybackminer.core.archive;

import com.waybackminer.core.model.Snapshot;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** 캡처 1건의 원본 내용(frame-free 재생). */
public class ContentFetcher {

    /** 아카이브가 캡처를 내줄 수 없을 때 본문에 넣는 문구 */
    public static final String CAPTURE_UNAVAILABLE_FINGERPRINT =
            "This page can't be displayed. Please use the correct URL address to access";

    private final ArchiveClient client;

    public ContentFetcher(ArchiveClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * 빈 문자열은 실패가 아니다(추출할 내용 없음).
     * @throws CaptureUnavailableException 아카이브가 캡처를 내줄 수 없다고 응답
     * @throws ArchiveException 전송/상태 코드 실패
     */
    public String fetch(Snapshot snapshot, AtomicBoolean cancel) throws ArchiveException, InterruptedException {
        String content = client.get(client.replayUri(snapshot), cancel);
        if (content.isEmpty()) return content;
        if (content.contains(CAPTURE_UNAVAILABLE_FINGERPRINT)) {
            throw new CaptureUnavailableException(snapshot.timestamp() + "/" + snapshot.original());
        }
        return content;
    }
}
