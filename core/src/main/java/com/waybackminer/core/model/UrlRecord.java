package com.waybackminer.core.model;

import java.util.Objects;

/**
 * 하베스터가 방출하는 URL 한 건.
 * source 는 출처 태그("wayback", "wayback:robots", "wayback:source").
 */
public record UrlRecord(String source, String value) {
    public UrlRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(value, "value");
    }
}
