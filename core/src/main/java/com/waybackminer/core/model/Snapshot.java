package com.waybackminer.core.model;

import java.util.Objects;

/** 아카이브 캡처 1건. timestamp 는 아카이브가 준 그대로(검증하지 않음). */
public record Snapshot(String timestamp, String original) {
    public Snapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(original, "original");
    }
}
