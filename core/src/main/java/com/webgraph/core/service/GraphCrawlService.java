// core/src/main/java/com/webgraph/core/service/GraphCrawlService.java
package com.webgraph.core.service;

import com.webgraph.core.crawler.ResultBudget;
import com.webgraph.core.crawler.WebCrawler;
import com.webgraph.core.graph.WebGraph;
import com.webgraph.core.model.CrawlStats;
import com.webgraph.core.model.CrawlerConfig;
import com.webgraph.core.util.ProgressListener;
import com.webgraph.core.util.StructuredLog;
import com.webgraph.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 오케스트레이터:
 *  - config → fetcher → crawler 배선
 *  - concurrency == 1 : WebCrawler.crawlMultipleUrls (시드 순차, 누적 노드 수로 시드 발행 중단)
 *  - concurrency  > 1 : 고정 스레드풀에서 시드 병렬 크롤
 *      · 시드마다 독립 SessionConfig (공유 세션 상태 없음)
 *      · 전역 ResultBudget 하나를 모든 워커가 공유(노드 id 단위 예약) → 누적 노드 수 <= maxResults
 *      · 누적 그래프 병합은 WebGraph 락으로 직렬화
 *  - 취소 플래그는 시드 사이에서 확인, 취소 시 CancellationException
 */
public final class GraphCrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(GraphCrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(GraphCrawlService.class);

    private final CrawlerConfig config;
    private final WebCrawler crawler;

    /** 기본 구현(jsoup fetcher) */
    public GraphCrawlService(CrawlerConfig config) {
        this(config, new WebCrawler(config));
    }

    /** DI/테스트용 */
    public GraphCrawlService(CrawlerConfig config, WebCrawler crawler) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.crawler = Objects.requireNonNull(crawler, "crawler");
    }

    public static GraphCrawlService fromYaml(Path yamlPath) throws IOException {
        return new GraphCrawlService(YamlConfigLoader.load(yamlPath));
    }

    /* =========================
       실행 API
       ========================= */

    public WebGraph run() {
        return run(ProgressListener.NONE, null);
    }

    public WebGraph run(ProgressListener listener) {
        return run(listener, null);
    }

    /** listener 는 concurrency > 1 이면 워커 스레드에서 호출된다. listener 예외는 두 모드 모두 호출자에게 전파. */
    public WebGraph run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final List<String> seeds = config.getSeeds();
        final int cc = Math.max(1, config.getConcurrency());

        LOG.info("Crawl start: seeds={}, maxDepth={}, maxResults={}, cc={}",
                seeds.size(), config.getMaxDepth(), config.getMaxResults(), cc);
        SLOG.info("crawl-start",
                "seeds", seeds.size(),
                "maxDepth", config.getMaxDepth(),
                "maxResults", config.getMaxResults(),
                "cc", cc);

        checkCancel(cancelFlag);

        WebGraph result;
        if (cc == 1 || seeds.size() <= 1) {
            // 순차: 시드 사이마다 취소 확인
            result = crawler.crawlMultipleUrls(seeds, config.getMaxDepth(), config.getMaxResults(),
                    (p, phase, done, total) -> {
                        pl.onProgress(p, phase, done, total);
                        if (!"done".equals(phase)) checkCancel(cancelFlag);
                    });
        } else {
            result = runConcurrently(seeds, cc, pl, cancelFlag);
            pl.onProgress(1.0, "done", seeds.size(), seeds.size());
        }

        CrawlStats.Snapshot s = crawler.getStats().snapshot();
        LOG.info("Crawl done. nodes={}, edges={}, fetchFailures={}, seedsSkipped={}",
                result.nodeCount(), result.edgeCount(), s.fetchFailures(), s.seedsSkipped());
        SLOG.info("crawl-summary",
                "nodes", result.nodeCount(),
                "edges", result.edgeCount(),
                "pagesExpanded", s.pagesExpanded(),
                "fetchFailures", s.fetchFailures(),
                "linksFiltered", s.linksFiltered(),
                "seedsCrawled", s.seedsCrawled(),
                "seedsSkipped", s.seedsSkipped(),
                "seedsFailed", s.seedsFailed());
        return result;
    }

    private WebGraph runConcurrently(List<String> seeds, int cc, ProgressListener pl, AtomicBoolean cancel) {
        final WebGraph accumulator = new WebGraph();
        final ResultBudget budget = ResultBudget.of(config.getMaxResults());
        final CrawlStats stats = crawler.getStats();
        final AtomicInteger donePages = new AtomicInteger(0);
        final int total = seeds.size();

        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl-worker"));
        List<Future<?>> futures = new ArrayList<>(total);
        try {
            for (String seed : seeds) {
                checkCancel(cancel);
                futures.add(exec.submit(() -> {
                    checkCancel(cancel);
                    try {
                        // 예산 소진(확인 직후 다른 워커가 소진한 경우 포함: 시드 노드조차 예약 못 함) → skipped
                        WebGraph sub = budget.isExhausted() ? new WebGraph()
                                : crawler.crawl(crawler.openSession(seed, config.isRestrictToSeedDomain()),
                                        seed, config.getMaxDepth(), budget);
                        if (sub.isEmpty()) {
                            stats.recordSeedSkipped();
                            SLOG.debug("seed-skipped", "seed", seed, "reason", "budget");
                        } else {
                            accumulator.mergeFrom(sub);
                            stats.recordSeedCrawled();
                        }
                    } catch (RuntimeException e) {
                        stats.recordSeedFailed();
                        LOG.warn("Seed {} failed: {}", seed, e.toString());
                        SLOG.warn("seed-failed", e, "seed", String.valueOf(seed));
                    }
                    int done = donePages.incrementAndGet();
                    pl.onProgress((double) done / total, "crawl", done, total);
                }));
            }

            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    // 시드 실패는 워커 안에서 처리됨. 여기 오는 건 취소/listener 예외 → 순차 모드와 같이 전파
                    if (cause instanceof CancellationException ce) throw ce;
                    SLOG.error("task-failed", cause, "cause", cause.toString());
                    if (cause instanceof RuntimeException re) throw re;
                    if (cause instanceof Error err) throw err;
                    throw new IllegalStateException("Crawl task failed", cause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        return accumulator;
    }

    /** 크롤 결과 노드들을 outDir 아래 Markdown 파일로 저장 */
    public List<Path> exportMarkdown(WebGraph graph, Path outDir) throws IOException {
        return new MarkdownExporter().export(graph, outDir);
    }

    public CrawlStats.Snapshot getStatsSnapshot() {
        return crawler.getStats().snapshot();
    }

    public CrawlerConfig getConfig() { return config; }

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException("crawl cancelled");
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
