package com.waybackminer.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** URL 판정 유틸: host 추출, 미디어/robots 판정, 관대한 URI 변환 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 이미지, 오디오, 비디오, 웹폰트: 본문 확장 대상에서 제외 */
    private static final Pattern MEDIA = Pattern.compile(
            "(?i)\\.(apng|bpm|png|bmp|gif|heif|ico|cur|jpg|jpeg|jfif|pjp|pjpeg|psd|raw|svg|tif|tiff|webp|xbm"
                    + "|3gp|aac|flac|mpg|mpeg|mp3|mp4|m4a|m4v|m4p|oga|ogg|ogv|mov|wav|webm"
                    + "|eot|woff|woff2|ttf|otf)(?:\\?|#|$)");

    // URI 파싱 실패 시 host만 뽑는 폴백
    private static final Pattern HOST = Pattern.compile(
            "^[a-zA-Z][a-zA-Z0-9+.-]*://(?:[^/?#@]*@)?(\\[[^\\]]*\\]|[^/?#:]+)");

    public static boolean isMedia(String url) {
        return url != null && MEDIA.matcher(url).find();
    }

    /** 경로가 정확히 /robots.txt 이고 쿼리가 없으면 robots 파일 */
    public static boolean isRobotsTxt(String url) {
        URI u = toUri(url);
        if (u == null || u.getScheme() == null) return false;
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return false;
        return "/robots.txt".equals(u.getRawPath()) && u.getRawQuery() == null;
    }

    /** 소문자 host(끝의 점 제거). 없거나 해석 불가면 null */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        String host = null;
        URI u = toUri(url.trim());
        if (u != null) host = u.getHost();
        if (host == null) {
            Matcher m = HOST.matcher(url.trim());
            if (m.find()) host = m.group(1);
        }
        if (host == null || host.isEmpty()) return null;
        host = host.toLowerCase(Locale.ROOT);
        while (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        return host.isEmpty() ? null : host;
    }

    /**
     * 아카이브가 돌려준 원문 URL은 RFC 위반 문자를 자주 포함한다.
     * 공백/따옴표/꺾쇠 등만 퍼센트 인코딩해서 다시 시도하고, 그래도 안 되면 null.
     */
    public static URI toUri(String s) {
        if (s == null) return null;
        try {
            return new URI(s);
        } catch (Exception first) {
            try {
                return new URI(escapeIllegal(s));
            } catch (Exception ignored) {
                return null;
            }
        }
    }

    static String escapeIllegal(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case ' ': sb.append("%20"); break;
                case '"': sb.append("%22"); break;
                case '<': sb.append("%3C"); break;
                case '>': sb.append("%3E"); break;
                case '\\': sb.append("%5C"); break;
                case '^': sb.append("%5E"); break;
                case '`': sb.append("%60"); break;
                case '{': sb.append("%7B"); break;
                case '|': sb.append("%7C"); break;
                case '}': sb.append("%7D"); break;
                case '%':
                    // 유효한 %XX 가 아니면 % 자체를 인코딩
                    if (i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) sb.append(c);
                    else sb.append("%25");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) continue;
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /** scheme://host[:port], 상대 경로 해석 기준 */
    public static String originOf(URI u) {
        if (u == null || u.getScheme() == null || u.getRawAuthority() == null) return null;
        return u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getRawAuthority();
    }
}
