package com.linkscout.core.crawler;

import com.linkscout.core.util.UrlUtils;

/** 추출된 절대 URL 의 채택 정책. */
public enum LinkPolicy {
    /** 크롤(트리) 모드: 로컬 파일 URL 또는 base 와 같은 netloc */
    IN_SCOPE {
        @Override public boolean accepts(String url, String baseUrl) {
            return UrlUtils.sameScope(url, baseUrl);
        }
    },
    /** 점검 모드: 도메인 제한 없이 유효 URL 또는 로컬 파일 URL 전부 */
    ANY_VALID {
        @Override public boolean accepts(String url, String baseUrl) {
            return UrlUtils.isFileUrl(url) || UrlUtils.isValid(url);
        }
    };

    public abstract boolean accepts(String url, String baseUrl);
}
