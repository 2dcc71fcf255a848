// IPageFetcher.java
package com.webtomd.core.api;

import com.webtomd.core.model.FetchResult;

/** 페이지 가져오기 최소 계약: 1회 시도, 실패해도 예외 없이 실패 결과를 돌려준다. */
@FunctionalInterface
public interface IPageFetcher {
    FetchResult fetch(String url);
}
