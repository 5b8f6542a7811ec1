package com.linkscout.core.crawler;

import java.util.Set;

/** HTML 에서 절대 URL 을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * baseUrl 기준으로 html 안의 링크를 절대 URL 집합으로 반환.
     * 파싱 실패는 빈 집합으로 처리하고 예외를 던지지 않는다.
     */
    Set<String> extract(String html, String baseUrl);
}
