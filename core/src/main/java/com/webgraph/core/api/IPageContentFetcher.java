package com.webgraph.core.api;

import com.webgraph.core.model.PageContent;

/** 페이지 본문을 Markdown 으로 가져오는 선택적 계약 (링크 수집과 별개). */
@FunctionalInterface
public interface IPageContentFetcher {
    PageContent fetchContent(String url) throws Exception;
}
