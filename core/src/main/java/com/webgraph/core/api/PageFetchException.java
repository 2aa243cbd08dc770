package com.webgraph.core.api;

/** 페이지 fetch/파싱 실패를 감싸는 체크 예외. 원인 예외는 cause로 보존. */
public class PageFetchException extends Exception {
    private final String url;

    public PageFetchException(String url, Throwable cause) {
        super("fetch failed: " + url + " (" + describe(cause) + ")", cause);
        this.url = url;
    }

    public String getUrl() { return url; }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }
}
