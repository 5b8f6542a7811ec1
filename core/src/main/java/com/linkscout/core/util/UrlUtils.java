package com.linkscout.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL 분류/해석 유틸.
 * - 정규화는 하지 않는다(후행 슬래시/대소문자/기본 포트가 다르면 서로 다른 URL)
 * - 파싱은 예외 없이 정규식으로 scheme / netloc / path 를 분리
 */
public final class UrlUtils {
    private UrlUtils(){}

    public static final String FILE_PREFIX = "file://";

    // scheme ":" [ "//" netloc ] rest
    private static final Pattern PARTS =
            Pattern.compile("^([A-Za-z][A-Za-z0-9+.\\-]*):(?://([^/?#]*))?([^?#]*)");
    private static final Pattern HAS_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:.*", Pattern.DOTALL);

    /** scheme 과 netloc 이 모두 비어있지 않으면 true */
    public static boolean isValid(String url) {
        return !scheme(url).isEmpty() && !netloc(url).isEmpty();
    }

    /** file:// 로 시작하는 로컬 파일 URL 여부 (scheme 대소문자 무시) */
    public static boolean isFileUrl(String url) {
        return url != null && url.regionMatches(true, 0, FILE_PREFIX, 0, FILE_PREFIX.length());
    }

    /**
     * candidate 가 base 와 같은 범위인지 판정.
     * 로컬 파일 URL 이거나, 유효하면서 netloc 이 base 와 정확히 같아야 한다(서브도메인 매칭 없음).
     */
    public static boolean sameScope(String candidate, String base) {
        if (isFileUrl(candidate)) return true;
        return isValid(candidate) && netloc(candidate).equals(netloc(base));
    }

    public static String scheme(String url) {
        Matcher m = parts(url);
        return m == null ? "" : m.group(1).toLowerCase(Locale.ROOT);
    }

    /** 포트/사용자정보 포함 authority 그대로 (대소문자 보존) */
    public static String netloc(String url) {
        Matcher m = parts(url);
        return (m == null || m.group(2) == null) ? "" : m.group(2);
    }

    public static String path(String url) {
        Matcher m = parts(url);
        return m == null ? "" : m.group(3);
    }

    private static Matcher parts(String url) {
        if (url == null) return null;
        Matcher m = PARTS.matcher(url.trim());
        return m.find() ? m : null;
    }

    /**
     * base 기준으로 href 를 절대 URL 로 변환. 해석 불가면 null.
     * - base 경로가 비어있으면 "/" 로 간주
     * - "?q" 형태는 base 경로 유지
     * - file 결과는 항상 file:// 형태 유지
     */
    public static String resolve(String base, String href) {
        if (href == null) return null;
        String rel = href.trim();
        if (rel.isEmpty()) return null;

        if (HAS_SCHEME.matcher(rel).matches()) {
            // 이미 절대 URL
            return fixFileForm(rel);
        }
        if (base == null || base.isBlank()) return null;

        try {
            URI b = new URI(escapeIllegal(base.trim()));
            if (b.getRawAuthority() != null && (b.getRawPath() == null || b.getRawPath().isEmpty())) {
                b = new URI(b.getScheme() + "://" + b.getRawAuthority() + "/"
                        + (b.getRawQuery() != null ? "?" + b.getRawQuery() : ""));
            }
            if (rel.startsWith("?")) {
                String s = b.getScheme() + ":"
                        + (b.getRawAuthority() != null ? "//" + b.getRawAuthority() : (isFileUrl(base) ? "//" : ""))
                        + b.getRawPath() + rel;
                return fixFileForm(s);
            }
            return fixFileForm(dropLeadingDotSegments(b.resolve(new URI(escapeIllegal(rel)))));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    // URI.resolve 는 루트 위로 올라가는 ".." 를 남긴다. 브라우저처럼 루트에서 멈춘다
    private static String dropLeadingDotSegments(URI r) {
        String p = r.getRawPath();
        if (p == null || !(p.startsWith("/../") || p.equals("/.."))) return r.toString();
        while (p.startsWith("/../")) p = p.substring(3);
        if (p.equals("/..")) p = "/";
        StringBuilder sb = new StringBuilder();
        sb.append(r.getScheme()).append(':');
        if (r.getRawAuthority() != null) sb.append("//").append(r.getRawAuthority());
        sb.append(p);
        if (r.getRawQuery() != null) sb.append('?').append(r.getRawQuery());
        if (r.getRawFragment() != null) sb.append('#').append(r.getRawFragment());
        return sb.toString();
    }

    // 브라우저가 관대하게 받아주는 문자(공백, 따옴표 등)만 퍼센트 인코딩
    private static String escapeIllegal(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ' ' || c == '"' || c == '<' || c == '>' || c == '\\' || c == '^'
                    || c == '`' || c == '{' || c == '|' || c == '}') {
                sb.append('%').append(String.format(Locale.ROOT, "%02X", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // java.net.URI 는 빈 authority 를 버리므로 "file:/x" → "file:///x" 로 복구
    private static String fixFileForm(String url) {
        if (url.regionMatches(true, 0, "file:", 0, 5) && !isFileUrl(url)) {
            String rest = url.substring(5);
            while (rest.startsWith("/")) rest = rest.substring(1);
            return FILE_PREFIX + "/" + rest;
        }
        return url;
    }

    /** file:// URL 의 경로 부분을 퍼센트 디코딩해 로컬 경로로 변환 */
    public static Path toLocalPath(String fileUrl) {
        String raw = path(fileUrl);
        String decoded;
        try {
            decoded = new URI(FILE_PREFIX + raw).getPath();
        } catch (URISyntaxException e) {
            // 인코딩 안 된 공백 등: 원문 경로 사용
            decoded = raw;
        }
        if (decoded == null || decoded.isEmpty()) decoded = raw;
        // Windows 드라이브 경로 "/C:/x" 보정
        if (decoded.length() > 2 && decoded.charAt(0) == '/' && decoded.charAt(2) == ':') {
            decoded = decoded.substring(1);
        }
        return Path.of(decoded);
    }
}
