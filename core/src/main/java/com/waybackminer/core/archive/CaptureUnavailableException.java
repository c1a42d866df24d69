package com.waybackminer.core.archive;

import com.waybackminer.core.model.FailureKind;

/** 아카이브가 캡처를 실제로 내줄 수 없다고 응답한 경우(빈 본문과는 구별된다). */
public final class CaptureUnavailableException extends ArchiveException {
    public CaptureUnavailableException(String target) {
        super(FailureKind.CAPTURE_UNAVAILABLE, target, "capture unavailable: " + target);
    }
}
