package com.waybackminer.core.api;

import com.waybackminer.core.model.FailureKind;

/**
 * 실패 사이드채널. 레코드 스트림 계약은 그대로 두고,
 * 조용히 버려지는 로컬 실패를 외부 집계기에 알린다.
 * 워커 스레드에서 동시에 호출될 수 있다.
 */
@FunctionalInterface
public interface HarvestDiagnostics {

    enum Stage { INDEX, SNAPSHOTS, CONTENT, DISPATCH }

    /**
     * @param stage  실패한 단계
     * @param target 요청 대상(URL 또는 timestamp/url)
     * @param kind   실패 분류
     * @param cause  원인(없을 수 있음)
     */
    void onFailure(Stage stage, String target, FailureKind kind, Throwable cause);

    HarvestDiagnostics NONE = (stage, target, kind, cause) -> {};

    default HarvestDiagnostics andThen(HarvestDiagnostics next) {
        if (next == null || next == NONE) return this;
        return (stage, target, kind, cause) -> {
            onFailure(stage, target, kind, cause);
            next.onFailure(stage, target, kind, cause);
        };
    }
}
