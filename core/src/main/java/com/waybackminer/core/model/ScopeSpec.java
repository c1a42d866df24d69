package com.waybackminer.core.model;

import com.waybackminer.core.util.UrlUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * 하베스트 범위.
 * host == rootDomain 이거나, includeSubdomains 일 때 rootDomain 의 하위 도메인이면 범위 안.
 */
public final class ScopeSpec {
    private final String rootDomain;
    private final boolean includeSubdomains;

    private ScopeSpec(String rootDomain, boolean includeSubdomains) {
        this.rootDomain = rootDomain;
        this.includeSubdomains = includeSubdomains;
    }

    /** "Example.COM.", "*.example.com" 같은 입력을 소문자 루트 도메인으로 정리한다. */
    public static ScopeSpec of(String domain, boolean includeSubdomains) {
        Objects.requireNonNull(domain, "domain");
        String d = domain.trim().toLowerCase(Locale.ROOT);
        if (d.startsWith("*.")) d = d.substring(2);
        while (d.endsWith(".")) d = d.substring(0, d.length() - 1);
        if (d.isEmpty()) throw new IllegalArgumentException("domain must not be blank");
        if (d.contains("/") || d.contains(" ")) {
            throw new IllegalArgumentException("domain must be a bare host name: " + domain);
        }
        return new ScopeSpec(d, includeSubdomains);
    }

    public String rootDomain() { return rootDomain; }
    public boolean includeSubdomains() { return includeSubdomains; }

    /** 인덱스 질의 대상: 하위 도메인 포함이면 와일드카드 형태. */
    public String queryTarget() {
        return includeSubdomains ? "*." + rootDomain : rootDomain;
    }

    public boolean contains(String url) {
        String host = UrlUtils.hostOf(url);
        if (host == null) return false;
        return containsHost(host);
    }

    public boolean containsHost(String host) {
        if (host == null || host.isEmpty()) return false;
        if (host.equals(rootDomain)) return true;
        return includeSubdomains && host.endsWith("." + rootDomain);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeSpec s)) return false;
        return includeSubdomains == s.includeSubdomains && rootDomain.equals(s.rootDomain);
    }

    @Override public int hashCode() { return Objects.hash(rootDomain, includeSubdomains); }

    @Override public String toString() {
        return "ScopeSpec{" + rootDomain + (includeSubdomains ? ", +subdomains" : "") + "}";
    }
}
