package com.webgraph.core.api;

import java.util.List;

/** 페이지 URL에서 outbound 하이퍼링크를 가져오는 외부 협력자 계약. */
@FunctionalInterface
public interface IPageFetcher {
    /**
     * url 페이지를 가져와 링크 URL 문자열을 문서 순서대로 반환.
     * 필터링/중복 제거는 하지 않는다. 네트워크/파싱 예외는 그대로 던진다.
     */
    List<String> fetchHyperlinks(String url) throws Exception;

    IPageFetcher NONE = url -> List.of();
}
