// ILinkChecker.java
package com.linkscout.core.api;

import com.linkscout.core.model.LinkCheckResult;

/** 링크 존재 확인 최소 계약: URL을 받아 상태 코드(또는 판단 불가)를 돌려준다. */
public interface ILinkChecker extends AutoCloseable {
    LinkCheckResult check(String url);
    @Override default void close() throws Exception {}
}
