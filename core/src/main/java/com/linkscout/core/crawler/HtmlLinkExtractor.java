package com.linkscout.core.crawler;

import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSoup 기반 링크 추출기. 네 가지 전략의 합집합:
 * <ol>
 *   <li>모든 요소의 URL 속성(href, src, action, data-* ...)</li>
 *   <li>meta refresh 의 url= 파라미터</li>
 *   <li>원문 HTML 의 CSS url(...)</li>
 *   <li>원문 HTML 의 http(s):// 문자열 (스크립트/텍스트 안전망)</li>
 * </ol>
 * 모든 후보는 HTML 엔티티 해제 후 base 기준 절대 URL 로 변환되고, {@link LinkPolicy} 로 걸러진다.
 */
public class HtmlLinkExtractor implements LinkExtractor {

    private static final Pattern META_URL = Pattern.compile("url=(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_URL = Pattern.compile("url\\(([^)]+)\\)");
    private static final Pattern RAW_URL = Pattern.compile("https?://[^\\s\"'<>]+");

    private final List<String> attributes;
    private final LinkPolicy policy;

    public HtmlLinkExtractor(LinkPolicy policy) {
        this(AuditConfig.DEFAULT_URL_ATTRIBUTES, policy);
    }

    public HtmlLinkExtractor(List<String> attributes, LinkPolicy policy) {
        this.attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public Set<String> extract(String html, String baseUrl) {
        Set<String> out = new HashSet<>();
        if (html == null || html.isEmpty() || baseUrl == null) return out;

        Document doc = Jsoup.parse(html);

        // 1) 속성 스캔
        for (Element el : doc.getAllElements()) {
            for (String attr : attributes) {
                if (!el.hasAttr(attr)) continue;
                accept(out, el.attr(attr), baseUrl);
            }
        }

        // 2) meta refresh
        for (Element meta : doc.select("meta[http-equiv]")) {
            if (!"refresh".equals(meta.attr("http-equiv").trim().toLowerCase(Locale.ROOT))) continue;
            Matcher m = META_URL.matcher(meta.attr("content"));
            if (m.find()) accept(out, stripQuotes(m.group(1)), baseUrl);
        }

        // 3) 인라인 CSS url(...)
        Matcher css = CSS_URL.matcher(html);
        while (css.find()) {
            accept(out, stripQuotes(css.group(1)), baseUrl);
        }

        // 4) 원문 정규식 안전망
        Matcher raw = RAW_URL.matcher(html);
        while (raw.find()) {
            accept(out, raw.group(), baseUrl);
        }
        return out;
    }

    private void accept(Set<String> out, String candidate, String baseUrl) {
        if (candidate == null || candidate.isEmpty()) return;
        // &#x2B; 같은 엔티티는 URL 해석 전에 풀어야 한다
        String unescaped = Parser.unescapeEntities(candidate, true);
        String abs = UrlUtils.resolve(baseUrl, unescaped);
        if (abs == null) return;
        if (policy.accepts(abs, baseUrl)) out.add(abs);
    }

    /** 양끝 공백과 따옴표(' ") 제거 */
    static String stripQuotes(String s) {
        if (s == null) return null;
        String t = s.trim();
        int b = 0, e = t.length();
        while (b < e && (t.charAt(b) == '\'' || t.charAt(b) == '"')) b++;
        while (e > b && (t.charAt(e - 1) == '\'' || t.charAt(e - 1) == '"')) e--;
        return t.substring(b, e);
    }
}
