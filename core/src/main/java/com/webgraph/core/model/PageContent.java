package com.webgraph.core.model;

import java.util.Objects;

/** 페이지 하나의 본문 변환 결과. title 은 없으면 "". */
public record PageContent(String url, String title, String markdown) {
    public PageContent {
        Objects.requireNonNull(url, "url");
        title = (title == null ? "" : title);
        markdown = (markdown == null ? "" : markdown);
    }
}
