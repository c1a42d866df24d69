package com.waybackminer.core.archive;

import com.waybackminer.core.model.FailureKind;

import java.io.IOException;
import java.util.Objects;

/** 아카이브 요청 하나의 로컬 실패. 호출자는 해당 분기만 비우고 계속 진행한다. */
public class ArchiveException extends IOException {
    private final FailureKind kind;
    private final String target;

    public ArchiveException(FailureKind kind, String target, String message) {
        this(kind, target, message, null);
    }

    public ArchiveException(FailureKind kind, String target, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = target;
    }

    public FailureKind kind() { return kind; }
    public String target() { return target; }
}
