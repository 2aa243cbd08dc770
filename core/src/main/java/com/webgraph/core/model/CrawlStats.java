package com.webgraph.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong pagesExpanded = new AtomicLong(0);   // fetch 시도한 노드 수
    private final AtomicLong fetchFailures = new AtomicLong(0);   // 실패 → 이웃 0개 처리
    private final AtomicLong linksFiltered = new AtomicLong(0);   // 도메인 허용 목록에서 걸러진 링크
    private final AtomicInteger seedsCrawled = new AtomicInteger(0);
    private final AtomicInteger seedsSkipped = new AtomicInteger(0); // 예산 소진으로 건너뜀
    private final AtomicInteger seedsFailed  = new AtomicInteger(0);

    public void recordExpansion() { pagesExpanded.incrementAndGet(); }
    public void recordFetchFailure() { fetchFailures.incrementAndGet(); }
    public void recordFiltered(int n) { if (n > 0) linksFiltered.addAndGet(n); }
    public void recordSeedCrawled() { seedsCrawled.incrementAndGet(); }
    public void recordSeedSkipped() { seedsSkipped.incrementAndGet(); }
    public void recordSeedFailed() { seedsFailed.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(pagesExpanded.get(), fetchFailures.get(), linksFiltered.get(),
                seedsCrawled.get(), seedsSkipped.get(), seedsFailed.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(long pagesExpanded, long fetchFailures, long linksFiltered,
                           int seedsCrawled, int seedsSkipped, int seedsFailed) { }
}
