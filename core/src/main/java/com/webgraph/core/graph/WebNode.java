package com.webgraph.core.graph;

import com.webgraph.core.api.IPageContentFetcher;
import com.webgraph.core.api.IPageFetcher;
import com.webgraph.core.api.PageFetchException;
import com.webgraph.core.model.PageContent;
import com.webgraph.core.util.UrlUtils;

import java.util.List;
import java.util.Objects;

/**
 * URL 하나를 감싼 그래프 노드.
 * 동일성은 id 문자열 비교(정규화 없음)로만 결정된다. 정규화가 필요하면 생성 전에 id를 바꿔서 넘긴다.
 */
public final class WebNode {
    private final String id;
    private final String domain;
    private final IPageFetcher fetcher;

    public WebNode(String id, IPageFetcher fetcher) {
        this.id = Objects.requireNonNull(id, "id");
        this.domain = UrlUtils.domainOf(id);
        this.fetcher = (fetcher != null ? fetcher : IPageFetcher.NONE);
    }

    public String getId() { return id; }

    /** host[:port], 없으면 "" */
    public String getDomain() { return domain; }

    /**
     * 페이지의 outbound 링크(원문, 필터/중복제거 전)를 문서 순서대로 반환.
     * fetcher 예외는 PageFetchException 으로 감싸 던진다. 실패를 어떻게 취급할지는 호출자 정책.
     */
    public List<String> fetchConnectedHyperlinks() throws PageFetchException {
        try {
            List<String> links = fetcher.fetchHyperlinks(id);
            return links == null ? List.of() : links;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(id, e);
        } catch (Exception e) {
            throw new PageFetchException(id, e);
        }
    }

    /**
     * 페이지 본문(Markdown). fetcher 가 IPageContentFetcher 가 아니면
     * UnsupportedOperationException 을 원인으로 한 PageFetchException.
     */
    public PageContent fetchContent() throws PageFetchException {
        if (!(fetcher instanceof IPageContentFetcher content)) {
            throw new PageFetchException(id,
                    new UnsupportedOperationException("fetcher does not provide page content"));
        }
        try {
            PageContent page = content.fetchContent(id);
            return page != null ? page : new PageContent(id, "", "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(id, e);
        } catch (Exception e) {
            throw new PageFetchException(id, e);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof WebNode other && id.equals(other.id);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() { return "WebNode[" + id + "]"; }
}
