package com.webgraph.core.crawler;

import com.webgraph.core.api.IPageContentFetcher;
import com.webgraph.core.api.IPageFetcher;
import com.webgraph.core.model.PageContent;

import java.io.IOException;
import java.util.*;

/** 테스트용 fetcher: 페이지별 링크/본문 맵 리턴 + 호출 기록, 지정 URL 은 IOException */
public final class MapFetcher implements IPageFetcher, IPageContentFetcher {
    private final Map<String, List<String>> adj = new LinkedHashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final Map<String, PageContent> pages = new HashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public MapFetcher link(String from, String... to) {
        adj.computeIfAbsent(from, k -> new ArrayList<>()).addAll(Arrays.asList(to));
        return this;
    }

    public MapFetcher fail(String url) {
        failing.add(url);
        return this;
    }

    public MapFetcher page(String url, String title, String markdown) {
        pages.put(url, new PageContent(url, title, markdown));
        return this;
    }

    /** seed → seed/1..seed/(n-1) 스타 그래프 (노드 n개) */
    public MapFetcher star(String seed, int n) {
        for (int i = 1; i < n; i++) link(seed, seed + i);
        return this;
    }

    @Override public List<String> fetchHyperlinks(String url) throws IOException {
        calls.add(url);
        if (failing.contains(url)) throw new IOException("boom: " + url);
        return adj.getOrDefault(url, List.of());
    }

    @Override public PageContent fetchContent(String url) throws IOException {
        if (failing.contains(url)) throw new IOException("boom: " + url);
        PageContent p = pages.get(url);
        if (p == null) throw new IOException("no page: " + url);
        return p;
    }

    public List<String> calls() {
        synchronized (calls) { return new ArrayList<>(calls); }
    }
}
