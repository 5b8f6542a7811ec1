package com.linkscout.core.crawler;

import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.model.FetchResult;
import com.linkscout.core.model.PageData;
import com.linkscout.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 기본 페이지 수집기.
 * - file:// → 로컬 파일 읽기(UTF-8, BOM 제거)
 * - 그 외 → GET (타임아웃/리다이렉트 설정 반영), 200 이외는 실패
 * 어떤 실패도 예외로 올리지 않고 경고 로그 + {@link FetchResult#failed} 로 돌려준다.
 */
public class DefaultPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final AuditConfig config;
    private final LinkExtractor extractor;
    private final HttpSender sender;

    public DefaultPageFetcher(AuditConfig config, LinkPolicy policy) {
        this(config, new HtmlLinkExtractor(config.getUrlAttributes(), policy));
    }

    public DefaultPageFetcher(AuditConfig config, LinkExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public DefaultPageFetcher(AuditConfig config, LinkExtractor extractor, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(String url) {
        Objects.requireNonNull(url, "url");
        String content;
        try {
            if (UrlUtils.isFileUrl(url)) {
                Path path = UrlUtils.toLocalPath(url);
                if (!Files.exists(path)) {
                    LOG.warn("Local file not found: {}", url);
                    return FetchResult.failed(url, "local file not found");
                }
                content = stripBom(Files.readString(path, StandardCharsets.UTF_8));
            } else {
                HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                        .timeout(config.getTimeout())
                        .header("User-Agent", config.getUserAgent())
                        .GET()
                        .build();
                HttpResponse<String> resp = sender.send(req);
                if (resp.statusCode() != 200) {
                    LOG.warn("Received status code {} for URL: {}", resp.statusCode(), url);
                    return FetchResult.failed(url, "status " + resp.statusCode());
                }
                content = (resp.body() == null) ? "" : resp.body();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while fetching {}", url);
            return FetchResult.failed(url, "interrupted");
        } catch (Exception e) {
            // DNS/연결 거부/타임아웃/읽기 오류 모두 여기서 흡수
            LOG.warn("Error fetching {}: {}", url, describe(e));
            return FetchResult.failed(url, describe(e));
        }
        return FetchResult.ok(parse(url, content));
    }

    /** 본문 → 제목/텍스트/이미지/링크 */
    PageData parse(String url, String content) {
        Document doc = Jsoup.parse(content);
        Element titleEl = doc.selectFirst("title");
        String title = (titleEl == null) ? "" : titleEl.text().trim();

        PageData.Builder b = PageData.builder()
                .url(url)
                .title(title)
                .text(doc.text());

        for (Element img : doc.select("img[src]")) {
            String src = UrlUtils.resolve(url, img.attr("src"));
            if (src == null) continue;
            b.image(src, img.attr("alt").trim());
        }
        return b.links(extractor.extract(content, url)).build();
    }

    private static String stripBom(String s) {
        return (!s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
    }

    static String describe(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
