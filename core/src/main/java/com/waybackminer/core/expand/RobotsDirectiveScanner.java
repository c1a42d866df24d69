package com.waybackminer.core.expand;

import com.waybackminer.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 본문에서 URL 을 참조하는 지시어만 뽑는다.
 * - 지원 지시어: Sitemap / Allow / Disallow (키 대소문자 무시)
 * - '#' 이후는 주석
 * - 절대 URL 은 그대로, 상대 경로는 robots 파일의 scheme://host 기준으로 해석
 * - 와일드카드 꼬리('*', '$')는 잘라내고, 와일드카드만 남는 값은 버림
 */
public final class RobotsDirectiveScanner {

    private RobotsDirectiveScanner() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");

    public static List<String> scan(String robotsTxt, URI robotsUri) {
        List<String> out = new ArrayList<>();
        if (robotsTxt == null || robotsTxt.isEmpty()) return out;
        String origin = UrlUtils.originOf(robotsUri);

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();
            if (val.isEmpty()) continue;

            switch (key) {
                case "sitemap", "allow", "disallow" -> {
                    String resolved = resolve(cleanWildcards(val), origin);
                    if (resolved != null) out.add(resolved);
                }
                default -> {
                    // User-agent, Crawl-delay, Host 등은 URL 이 아님
                }
            }
        }
        return out;
    }

    static String cleanWildcards(String v) {
        String s = v;
        int star = s.indexOf('*');
        if (star >= 0) s = s.substring(0, star);
        if (s.endsWith("$")) s = s.substring(0, s.length() - 1);
        return s.trim();
    }

    private static String resolve(String v, String origin) {
        if (v.isEmpty()) return null;
        String lower = v.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return v;
        if (origin == null) return null;
        if (v.startsWith("//")) {
            int i = origin.indexOf("://");
            return origin.substring(0, i + 1) + v;
        }
        return v.startsWith("/") ? origin + v : origin + "/" + v;
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }
}
