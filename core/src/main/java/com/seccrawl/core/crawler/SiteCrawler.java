package com.seccrawl.core.crawler;

import com.seccrawl.core.api.CrawlEventSink;
import com.seccrawl.core.api.IPageFetcher;
import com.seccrawl.core.model.CrawlScope;
import com.seccrawl.core.model.CrawlStats;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.util.NamedThreadFactory;
import com.seccrawl.core.util.StructuredLog;
import com.seccrawl.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 사이트 전체 크롤(BFS).
 * - 시작 URL 에서 링크를 따라가며 스코프 안의 페이지를 최대 maxPages 개 수집
 * - 실패한 URL 은 누락 처리하고 계속 진행(같은 실행 안에서는 다시 시도하지 않음)
 * - workers &gt; 1 이면 Frontier 를 공유하는 워커 풀로 동시에 가져온다
 */
public class SiteCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(SiteCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(SiteCrawler.class);

    private final IPageFetcher fetcher;
    private final Politeness politeness;
    private final int workers;
    private final CrawlEventSink events;
    private final CrawlStats stats;

    private volatile Frontier lastFrontier;

    public SiteCrawler(IPageFetcher fetcher, Politeness politeness, int workers,
                       CrawlEventSink events, CrawlStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.politeness = (politeness != null) ? politeness : Politeness.NONE;
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        this.workers = workers;
        this.events = (events != null) ? events : CrawlEventSink.NONE;
        this.stats = (stats != null) ? stats : new CrawlStats();
    }

    public List<Page> crawl(String startUrl, int maxPages, CrawlScope scope) {
        return crawl(startUrl, maxPages, scope, CrawlControl.unbounded());
    }

    /** @return 수집 순서대로의 페이지(최대 maxPages) */
    public List<Page> crawl(String startUrl, int maxPages, CrawlScope scope, CrawlControl control) {
        Objects.requireNonNull(control, "control");
        Frontier frontier = new Frontier(startUrl, maxPages, scope, events, stats);
        lastFrontier = frontier;
        LOG.info("Site crawl start: {} (maxPages={}, workers={})", startUrl, maxPages, workers);
        SLOG.info("crawl-start", "url", startUrl, "maxPages", maxPages, "workers", workers);

        if (workers == 1) {
            runWorker(frontier, control);
        } else {
            runPool(frontier, control);
        }

        List<Page> pages = frontier.collected();
        String reason = frontier.budgetReached() ? "max-pages"
                : control.isCancelled() ? "cancelled" : "frontier-exhausted";
        LOG.info("Site crawl done: pages={}, visited={}, reason={}", pages.size(), frontier.visited().size(), reason);
        SLOG.info("crawl-done", "pages", pages.size(), "visited", frontier.visited().size(), "reason", reason);
        events.onFinished(reason, pages.size());
        return pages;
    }

    /** 마지막 crawl() 의 frontier 상태(테스트/진단용) */
    public Frontier lastFrontier() { return lastFrontier; }

    private void runPool(Frontier frontier, CrawlControl control) {
        ExecutorService exec = Executors.newFixedThreadPool(workers, new NamedThreadFactory("crawl-worker"));
        List<Future<?>> futures = new ArrayList<>(workers);
        try {
            for (int i = 0; i < workers; i++) {
                futures.add(exec.submit(() -> runWorker(frontier, control)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Crawl worker failed: {}", cause.toString());
                    SLOG.error("worker-failed", cause, "cause", cause.toString());
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            control.cancel();
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runWorker(Frontier frontier, CrawlControl control) {
        try {
            while (true) {
                Optional<String> next = frontier.claim(control);
                if (next.isEmpty()) return;
                String url = next.get();
                String host = UrlUtils.host(url);

                PageResult result;
                try {
                    politeness.beforeFetch(host);
                    LOG.debug("Crawling: {}", url);
                    result = fetcher.fetch(url);
                } catch (InterruptedException ie) {
                    frontier.complete(url, new PageResult.Failed(url, PageResult.Cause.TRANSPORT, 0, "interrupted"));
                    throw ie;
                } catch (RuntimeException e) {
                    LOG.error("Unexpected error crawling {}: {}", url, e.toString());
                    result = new PageResult.Failed(url, PageResult.Cause.TRANSPORT, 0, e.toString());
                }
                frontier.complete(url, result);
                // 성공/실패와 무관하게 fetch 한 반복마다. 예산을 채운 뒤에는 쉬지 않는다
                if (!frontier.budgetReached()) politeness.afterFetch(host);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            control.cancel();
        }
    }
}
