// ICrawler.java
package com.webgraph.core.api;

import com.webgraph.core.graph.WebGraph;

import java.util.List;

/** 그래프 크롤러 최소 계약: 시드(들)에서 도달한 페이지 그래프를 돌려준다. */
public interface ICrawler extends AutoCloseable {
    /** 단일 시드 BFS. maxResults == null 이면 노드 수 무제한. */
    WebGraph crawl(String url, int maxDepth, Integer maxResults);

    /** 여러 시드를 순서대로 크롤하여 하나의 그래프로 병합. */
    WebGraph crawlMultipleUrls(List<String> urls, int maxDepth, Integer maxResults);

    default WebGraph crawlMultipleUrls(List<String> urls) {
        return crawlMultipleUrls(urls, 1, null);
    }

    @Override default void close() throws Exception {}
}
