package com.pagelens.core.api;

import com.pagelens.core.model.FetchedPage;

import java.net.URI;

/**
 * 페이지 수집 계약. URL 검증(UrlResolver.normalize)을 통과한 URI만 넘겨야 한다.
 * 재시도 정책은 구현체 책임.
 */
public interface IPageFetcher extends AutoCloseable {
    FetchedPage fetch(URI url);
    @Override default void close() throws Exception {}
}
