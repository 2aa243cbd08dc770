package com.webgraph.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 실행 설정 (fluent setter + validate).
 * YAML 로딩은 YamlConfigLoader 참고.
 */
public class CrawlerConfig {

    public static final String DEFAULT_USER_AGENT = "WebGraphCrawler/0.1 (+crawler)";

    // ---------- 필드(기본값) ----------
    private List<String> seeds = List.of();
    private List<String> allowedDomains = List.of();   // 비어 있으면 무제한
    private int maxDepth = 1;
    private Integer maxResults = null;                 // null = 무제한
    private boolean restrictToSeedDomain = true;
    private boolean canonicalizeUrls = false;          // 기본: id = 원문 문자열
    private int concurrency = 1;                       // 1 = 시드 순차 처리

    // fetch
    private Duration timeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;

    // ---------- getters ----------
    public List<String> getSeeds() { return seeds; }
    public List<String> getAllowedDomains() { return allowedDomains; }
    public int getMaxDepth() { return maxDepth; }
    public Integer getMaxResults() { return maxResults; }
    public boolean isRestrictToSeedDomain() { return restrictToSeedDomain; }
    public boolean isCanonicalizeUrls() { return canonicalizeUrls; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }

    // ---------- fluent setters ----------
    public CrawlerConfig setSeeds(List<String> seeds) {
        this.seeds = (seeds == null ? List.of() : copyNonNull(seeds));
        return this;
    }
    public CrawlerConfig setAllowedDomains(List<String> domains) {
        this.allowedDomains = (domains == null ? List.of() : copyNonNull(domains));
        return this;
    }
    public CrawlerConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlerConfig setMaxResults(Integer maxResults) { this.maxResults = maxResults; return this; }
    public CrawlerConfig setRestrictToSeedDomain(boolean v) { this.restrictToSeedDomain = v; return this; }
    public CrawlerConfig setCanonicalizeUrls(boolean v) { this.canonicalizeUrls = v; return this; }
    public CrawlerConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlerConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlerConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlerConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }

    public CrawlerConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(seeds, "seeds");
        Objects.requireNonNull(allowedDomains, "allowedDomains");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxResults != null && maxResults < 1) throw new IllegalArgumentException("maxResults must be >= 1");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
    }

    // ---------- helpers ----------
    public static CrawlerConfig defaults() { return new CrawlerConfig(); }

    /** jsoup timeout(int ms) 용 */
    public int getTimeoutMsInt() {
        long ms = timeout.toMillis();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    private static List<String> copyNonNull(List<String> in) {
        List<String> out = new ArrayList<>(in.size());
        for (String s : in) if (s != null) out.add(s);
        return List.copyOf(out);
    }
}
