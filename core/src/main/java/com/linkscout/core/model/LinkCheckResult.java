package com.linkscout.core.model;

import java.util.Objects;

/**
 * 링크 존재 확인(HEAD) 결과.
 * status == null 이면 "판단 불가"(전송 실패), error 에 예외 메시지가 들어간다.
 * 정상 상태 코드도 버리지 않고 돌려준다(error 는 빈 문자열).
 */
public record LinkCheckResult(String url, Integer status, String error) {

    public LinkCheckResult {
        Objects.requireNonNull(url, "url");
        error = (error == null) ? "" : error;
    }

    public static LinkCheckResult unreachable(String url, String error) {
        return new LinkCheckResult(url, null, error);
    }

    public boolean isDetermined() { return status != null; }
}
