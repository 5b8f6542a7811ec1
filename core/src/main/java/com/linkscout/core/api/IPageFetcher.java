// IPageFetcher.java
package com.linkscout.core.api;

import com.linkscout.core.model.FetchResult;

/** 페이지 가져오기 최소 계약: URL을 받아 성공(PageData)/실패 결과를 돌려준다. 예외를 던지지 않는다. */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(String url);
    @Override default void close() throws Exception {}
}
