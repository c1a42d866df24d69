package com.waybackminer.core.expand;

import com.waybackminer.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 패턴 기반 URL 추출 (HTML/JS 파서가 아님).
 * - 절대 URL: http(s)://host...
 * - 프로토콜 상대: //host/... (따옴표/괄호/= 뒤에서만)
 * - 루트 상대: "/path" 또는 '/path'
 * JS 문자열의 "\/" 이스케이프는 먼저 풀어둔다.
 * 재생 본문의 아카이브 래핑 링크(/web/&lt;ts&gt;[mod_]/&lt;원래 URL&gt;)도 먼저 벗겨낸다.
 */
public final class SourceLinkPatterns {

    private SourceLinkPatterns() {}

    private static final String TAIL = "(?::\\d{1,5})?(?:[/?#][^\\s\"'<>\\\\(){}\\[\\]|^`]*)?";
    private static final String LABEL = "[a-z0-9](?:[a-z0-9-]*[a-z0-9])?";

    static final Pattern ABSOLUTE = Pattern.compile(
            "(?i)https?://" + LABEL + "(?:\\." + LABEL + ")*" + TAIL);

    static final Pattern PROTOCOL_RELATIVE = Pattern.compile(
            "(?i)(?<=[\"'(=\\s])//" + LABEL + "(?:\\." + LABEL + ")+" + TAIL);

    /** 뒤에 절대/프로토콜 상대 URL 이 오는 경우만 */
    static final Pattern ARCHIVE_PREFIX = Pattern.compile(
            "(?i)(?:(?:https?:)?//web\\.archive\\.org)?/web/\\d{1,14}[a-z_]*/(?=(?:https?:)?//)");

    static final Pattern ROOT_RELATIVE = Pattern.compile(
            "[\"'](/(?!/)[^\"'\\s<>\\\\]*)[\"']");

    /**
     * @param content    캡처 본문
     * @param base       캡처의 원래 URL (상대 경로 기준)
     * @param rootDomain 이 도메인 또는 하위 도메인의 URL 만 돌려준다
     */
    public static List<String> extract(String content, URI base, String rootDomain) {
        if (content == null || content.isEmpty() || rootDomain == null) return List.of();
        String text = unwrapArchiveLinks(content.replace("\\/", "/"));
        String domain = rootDomain.toLowerCase(Locale.ROOT);
        String origin = UrlUtils.originOf(base);
        String scheme = (base != null && base.getScheme() != null)
                ? base.getScheme().toLowerCase(Locale.ROOT) : "http";

        Set<String> out = new LinkedHashSet<>();

        Matcher abs = ABSOLUTE.matcher(text);
        while (abs.find()) {
            add(out, trimTrailing(abs.group()), domain);
        }

        Matcher rel = PROTOCOL_RELATIVE.matcher(text);
        while (rel.find()) {
            add(out, scheme + ":" + trimTrailing(rel.group()), domain);
        }

        if (origin != null) {
            Matcher root = ROOT_RELATIVE.matcher(text);
            while (root.find()) {
                add(out, origin + root.group(1), domain);
            }
        }
        return new ArrayList<>(out);
    }

    static String unwrapArchiveLinks(String text) {
        return ARCHIVE_PREFIX.matcher(text).replaceAll("");
    }

    private static void add(Set<String> out, String url, String domain) {
        String host = UrlUtils.hostOf(url);
        if (host == null) return;
        if (host.equals(domain) || host.endsWith("." + domain)) out.add(url);
    }

    /** 문장 부호로 끝나는 매치("...see https://a.com/x.") 정리 */
    static String trimTrailing(String s) {
        int end = s.length();
        while (end > 0 && ".,;:!?)".indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(0, end);
    }
}
