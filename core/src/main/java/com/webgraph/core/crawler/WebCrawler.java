package com.webgraph.core.crawler;

import com.webgraph.core.api.ICrawler;
import com.webgraph.core.api.IPageFetcher;
import com.webgraph.core.api.PageFetchException;
import com.webgraph.core.graph.WebGraph;
import com.webgraph.core.graph.WebNode;
import com.webgraph.core.model.CrawlStats;
import com.webgraph.core.model.CrawlerConfig;
import com.webgraph.core.util.ProgressListener;
import com.webgraph.core.util.StructuredLog;
import com.webgraph.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * BFS 기반 그래프 크롤러
 * - base 허용 도메인(생성 시 고정) + 세션 허용 도메인(세션 시작마다 교체)
 * - maxDepth(시드로부터 hop 수) / maxResults(노드 수) 제한
 * - 링크 수집은 IPageFetcher에 위임, fetch 실패는 이웃 0개로 취급(dead end)
 *
 * 상태 있는 API(startNewCrawlingSession → inAllowedDomain/visitNodeNeighborhood)는 인스턴스당
 * 활성 세션 1개를 가정한다. 동시 세션은 openSession()으로 받은 SessionConfig를 직접 넘기는
 * 오버로드를 쓴다.
 */
public class WebCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(WebCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(WebCrawler.class);

    private final List<String> baseAllowedDomains;
    private final IPageFetcher fetcher;
    private final boolean restrictToSeedDomain;
    private final boolean canonicalizeUrls;
    private final CrawlStats stats = new CrawlStats();

    private volatile SessionConfig session;

    public WebCrawler(IPageFetcher fetcher) {
        this(List.of(), fetcher);
    }

    public WebCrawler(List<String> allowedDomains, IPageFetcher fetcher) {
        this(allowedDomains, fetcher, true, false);
    }

    /** 설정 기반(기본 jsoup fetcher) */
    public WebCrawler(CrawlerConfig config) {
        this(config, new JsoupPageFetcher(config));
    }

    /** DI/테스트용 */
    public WebCrawler(CrawlerConfig config, IPageFetcher fetcher) {
        this(Objects.requireNonNull(config, "config").getAllowedDomains(), fetcher,
                config.isRestrictToSeedDomain(), config.isCanonicalizeUrls());
    }

    private WebCrawler(List<String> allowedDomains, IPageFetcher fetcher,
                       boolean restrictToSeedDomain, boolean canonicalizeUrls) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.restrictToSeedDomain = restrictToSeedDomain;
        this.canonicalizeUrls = canonicalizeUrls;
        this.session = SessionConfig.unrestricted(allowedDomains);
        this.baseAllowedDomains = this.session.baseAllowedDomains();
    }

    /* =========================
       노드 / 세션
       ========================= */

    /** id(URL)에 해당하는 노드. canonicalizeUrls=true 면 정규화된 id 사용 */
    public WebNode getNode(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
        return new WebNode(idOf(nodeId), fetcher);
    }

    private String idOf(String url) {
        return canonicalizeUrls ? UrlUtils.canonicalize(url.trim()) : url;
    }

    /** 크롤러 상태를 바꾸지 않고 세션 컨텍스트만 계산 */
    public SessionConfig openSession(String startNodeId, boolean restrictToDomain) {
        WebNode start = getNode(startNodeId);
        return restrictToDomain
                ? new SessionConfig(baseAllowedDomains, List.of(start.getDomain()))
                : SessionConfig.unrestricted(baseAllowedDomains);
    }

    public WebGraph startNewCrawlingSession(String startNodeId) {
        return startNewCrawlingSession(startNodeId, true);
    }

    /**
     * 새 세션 시작: restrictToDomain 이면 세션 허용 목록 = [시작 노드 도메인], 아니면 비움.
     * 이전 세션 값과 무관하게 교체된다. 시작 노드만 담긴 새 그래프를 반환.
     */
    public WebGraph startNewCrawlingSession(String startNodeId, boolean restrictToDomain) {
        WebNode start = getNode(startNodeId);
        SessionConfig ctx = openSession(start.getId(), restrictToDomain);
        this.session = ctx;
        WebGraph graph = new WebGraph();
        graph.addNode(start);
        LOG.debug("Session started at {} (sessionDomains={})", start.getId(), ctx.sessionAllowedDomains());
        return graph;
    }

    public SessionConfig currentSession() { return session; }

    public List<String> getBaseAllowedDomains() { return baseAllowedDomains; }

    public List<String> getSessionAllowedDomains() { return session.sessionAllowedDomains(); }

    public CrawlStats getStats() { return stats; }

    /* =========================
       도메인 판정 / 이웃 확장
       ========================= */

    public boolean inAllowedDomain(String url) {
        return session.admits(url);
    }

    public List<WebNode> visitNodeNeighborhood(WebNode node) {
        return visitNodeNeighborhood(session, node);
    }

    /**
     * node 페이지의 링크 중 허용 도메인만 노드로 만들어 fetch 순서대로 반환(중복 제거 안 함).
     * 정규화가 켜져 있으면 판정 전에 id를 정규화한다.
     * fetch 실패는 여기서만 처리한다: 로그 + 카운트 후 빈 목록.
     */
    public List<WebNode> visitNodeNeighborhood(SessionConfig ctx, WebNode node) {
        Objects.requireNonNull(ctx, "session");
        Objects.requireNonNull(node, "node");
        stats.recordExpansion();

        List<String> raw;
        try {
            raw = node.fetchConnectedHyperlinks();
        } catch (PageFetchException e) {
            stats.recordFetchFailure();
            LOG.warn("Fetch failed, treating {} as a dead end: {}", node.getId(),
                    e.getCause() != null ? e.getCause().toString() : e.getMessage());
            SLOG.warn("fetch-failed", e.getCause(), "url", node.getId());
            return List.of();
        }

        List<WebNode> allowed = new ArrayList<>(raw.size());
        int filtered = 0;
        for (String link : raw) {
            if (link == null || link.isBlank()) continue;
            String id = idOf(link);
            if (!ctx.admits(id)) {
                filtered++;
                continue;
            }
            allowed.add(new WebNode(id, fetcher));
        }
        stats.recordFiltered(filtered);
        return allowed;
    }

    /* =========================
       단일 시드 크롤
       ========================= */

    @Override
    public WebGraph crawl(String url, int maxDepth, Integer maxResults) {
        checkDepth(maxDepth);
        if (maxResults != null && maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1");
        }
        WebNode seed = getNode(url);
        SessionConfig ctx = openSession(seed.getId(), restrictToSeedDomain);
        this.session = ctx;
        return traverse(ctx, seed, maxDepth, ResultBudget.of(maxResults));
    }

    /** 상태 없는 변형: 세션/예산을 호출자가 넘긴다(동시 시드 크롤용). */
    public WebGraph crawl(SessionConfig ctx, String url, int maxDepth, ResultBudget budget) {
        checkDepth(maxDepth);
        Objects.requireNonNull(ctx, "session");
        Objects.requireNonNull(budget, "budget");
        return traverse(ctx, getNode(url), maxDepth, budget);
    }

    /**
     * FIFO BFS. 시드 depth=0, depth < maxDepth 인 노드만 확장.
     * 새 노드는 예산 1(id 단위)을 예약해야 추가되고, 예산이 바닥나면 더 이상 fetch 하지 않는다.
     * 간선은 그래프에 들어간 노드 사이에만 기록.
     */
    private WebGraph traverse(SessionConfig ctx, WebNode seed, int maxDepth, ResultBudget budget) {
        WebGraph graph = new WebGraph();
        if (!budget.tryReserve(seed.getId())) return graph;
        graph.addNode(seed);

        Deque<Frontier> q = new ArrayDeque<>();
        q.addLast(new Frontier(seed, 0));

        while (!q.isEmpty()) {
            Frontier cur = q.pollFirst();
            if (cur.depth >= maxDepth) continue;
            if (budget.isExhausted()) break;

            for (WebNode n : visitNodeNeighborhood(ctx, cur.node)) {
                if (!graph.containsNode(n.getId())) {
                    // 예산 부족: 새 노드만 버리고 이미 있는 노드로의 간선은 계속 기록
                    if (!budget.tryReserve(n.getId())) continue;
                    graph.addNode(n);
                    q.addLast(new Frontier(n, cur.depth + 1));
                }
                graph.addEdge(cur.node, n);
            }
        }

        LOG.info("Crawled {} -> nodes={}, edges={}", seed.getId(), graph.nodeCount(), graph.edgeCount());
        SLOG.info("seed-done",
                "seed", seed.getId(),
                "maxDepth", maxDepth,
                "nodes", graph.nodeCount(),
                "edges", graph.edgeCount());
        return graph;
    }

    /* =========================
       다중 시드 크롤
       ========================= */

    @Override
    public WebGraph crawlMultipleUrls(List<String> urls, int maxDepth, Integer maxResults) {
        return crawlMultipleUrls(urls, maxDepth, maxResults, ProgressListener.NONE);
    }

    public WebGraph crawlMultipleUrls(List<String> urls, int maxDepth) {
        return crawlMultipleUrls(urls, maxDepth, null);
    }

    /**
     * 시드를 입력 순서대로 하나씩 크롤해 누적 그래프에 병합.
     * 누적 노드 수가 maxResults 에 도달하면 남은 시드는 발행하지 않는다(사후 trim 없음, soft bound).
     * 시드 하나의 실패는 로그만 남기고 다음 시드로 진행. listener 예외는 그대로 전파된다.
     */
    public WebGraph crawlMultipleUrls(List<String> urls, int maxDepth, Integer maxResults,
                                      ProgressListener listener) {
        Objects.requireNonNull(urls, "urls");
        checkDepth(maxDepth);
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        WebGraph accumulator = new WebGraph();
        Integer remaining = maxResults;
        final int total = urls.size();
        int done = 0;

        for (String url : urls) {
            if (maxResults != null) {
                remaining = maxResults - accumulator.nodeCount();
                if (remaining <= 0) break;
            }
            try {
                WebGraph sub = crawl(url, maxDepth, remaining);
                accumulator.mergeFrom(sub);
                stats.recordSeedCrawled();
            } catch (RuntimeException e) {
                stats.recordSeedFailed();
                LOG.warn("Seed {} failed: {}", url, e.toString());
                SLOG.warn("seed-failed", e, "seed", String.valueOf(url));
            }
            done++;
            pl.onProgress((double) done / total, "crawl", done, total);
        }

        for (int i = done; i < total; i++) stats.recordSeedSkipped();
        if (done < total) {
            LOG.info("Result budget reached ({}), skipped {} seed(s)", maxResults, total - done);
        }

        pl.onProgress(1.0, "done", done, total);
        SLOG.info("crawl-done",
                "seeds", total,
                "seedsIssued", done,
                "nodes", accumulator.nodeCount(),
                "edges", accumulator.edgeCount());
        return accumulator;
    }

    private static void checkDepth(int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
    }

    private record Frontier(WebNode node, int depth) { }
}
