package com.linkscout.core.http;

import com.linkscout.core.api.ILinkChecker;
import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.model.LinkCheckResult;
import com.linkscout.core.util.UrlUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.util.Objects;
import java.util.Set;

/**
 * HEAD 요청으로 링크 존재 여부만 가볍게 확인.
 * - 리다이렉트는 따라가고 최종 상태 코드를 돌려준다
 * - 상태 코드가 오류 집합에 있으면 error = "Status &lt;code&gt;"
 * - 전송 실패(DNS/연결/타임아웃)는 status=null + 예외 메시지
 * - file:// 링크는 파일 존재 여부로 200/404 판정
 */
public class HttpLinkChecker implements ILinkChecker {

    /** 테스트/모킹용 송신 훅: 상태 코드만 돌려주면 된다 */
    @FunctionalInterface
    public interface HttpSender {
        int send(HttpRequest req) throws Exception;
    }

    private final AuditConfig config;
    private final Set<Integer> errorStatuses;
    private final HttpSender sender;

    public HttpLinkChecker(AuditConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.errorStatuses = Set.copyOf(config.getErrorStatuses());
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)   // 점검은 항상 최종 목적지 기준
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpLinkChecker(AuditConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.errorStatuses = Set.copyOf(config.getErrorStatuses());
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public LinkCheckResult check(String url) {
        Objects.requireNonNull(url, "url");
        try {
            int status = UrlUtils.isFileUrl(url) ? checkLocal(url) : checkRemote(url);
            return classify(url, status);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return LinkCheckResult.unreachable(url, "interrupted");
        } catch (Exception e) {
            return LinkCheckResult.unreachable(url, describe(e));
        }
    }

    /** 상태 코드 → 결과. 오류 집합에 속할 때만 메시지를 채운다 */
    LinkCheckResult classify(String url, int status) {
        if (errorStatuses.contains(status)) {
            return new LinkCheckResult(url, status, "Status " + status);
        }
        return new LinkCheckResult(url, status, "");
    }

    public boolean isErrorStatus(Integer status) {
        return status != null && errorStatuses.contains(status);
    }

    private int checkRemote(String url) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        return sender.send(req);
    }

    private static int checkLocal(String url) {
        return Files.exists(UrlUtils.toLocalPath(url)) ? 200 : 404;
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
