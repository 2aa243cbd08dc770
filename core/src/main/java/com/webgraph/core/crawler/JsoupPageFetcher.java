package com.webgraph.core.crawler;

import com.webgraph.core.api.IPageContentFetcher;
import com.webgraph.core.api.IPageFetcher;
import com.webgraph.core.model.CrawlerConfig;
import com.webgraph.core.model.PageContent;
import com.webgraph.core.util.MarkdownConverter;
import com.webgraph.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 기본 JSoup 기반 fetcher
 * - 링크: a[href] → abs:href 를 문서 순서대로 수집 (http/https 만)
 * - 본문: body 를 Markdown 으로 변환 (링크는 절대 URL 로 바꾼 뒤 변환)
 */
public class JsoupPageFetcher implements IPageFetcher, IPageContentFetcher {
    private final int timeoutMs;
    private final boolean followRedirects;
    private final String userAgent;

    public JsoupPageFetcher(CrawlerConfig cfg) {
        this(cfg.getTimeoutMsInt(), cfg.isFollowRedirects(), cfg.getUserAgent());
    }

    public JsoupPageFetcher(long timeoutMs, boolean followRedirects, String userAgent) {
        // jsoup timeout은 int 필요 → 안전 캐스팅
        long clamped = Math.max(0, Math.min(Integer.MAX_VALUE, timeoutMs));
        this.timeoutMs = (int) clamped;
        this.followRedirects = followRedirects;
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? CrawlerConfig.DEFAULT_USER_AGENT : userAgent;
    }

    @Override
    public List<String> fetchHyperlinks(String url) throws IOException {
        Document doc = load(url);

        List<String> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            abs = abs.trim();
            if (UrlUtils.isHttpLike(abs)) out.add(abs);
        }
        return out;
    }

    @Override
    public PageContent fetchContent(String url) throws IOException {
        Document doc = load(url);
        for (Element a : doc.select("a[href]")) {
            String abs = a.absUrl("href");
            if (!abs.isEmpty()) a.attr("href", abs);
        }
        String body = (doc.body() != null ? doc.body().html() : "");
        return new PageContent(url, doc.title(), MarkdownConverter.toMarkdown(body));
    }

    private Document load(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Encoding", "gzip, deflate")
                .timeout(timeoutMs)
                .followRedirects(followRedirects)
                .get();
    }
}
