package com.seccrawl.core.crawler;

import com.seccrawl.core.api.CrawlEventSink;
import com.seccrawl.core.api.IPageFetcher;
import com.seccrawl.core.crawler.pagination.NextStep;
import com.seccrawl.core.crawler.pagination.PaginationStrategy;
import com.seccrawl.core.model.CrawlScope;
import com.seccrawl.core.model.CrawlStats;
import com.seccrawl.core.model.ExtractedElement;
import com.seccrawl.core.model.ExtractionRecord;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.parse.MarkupExtractor;
import com.seccrawl.core.scope.ScopePolicy;
import com.seccrawl.core.util.StructuredLog;
import com.seccrawl.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 페이지네이션 크롤: 페이지마다 dataSelector 매칭 요소를 뽑아 ExtractionRecord 로 쌓는다.
 * 중단 조건: fetch 실패, 매칭 없음, maxPages 도달, 다음 URL 없음/스코프 밖/이미 방문, 취소.
 */
public class PaginatedCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(PaginatedCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(PaginatedCrawler.class);

    private final IPageFetcher fetcher;
    private final MarkupExtractor extractor;
    private final Politeness politeness;
    private final CrawlEventSink events;
    private final CrawlStats stats;

    public PaginatedCrawler(IPageFetcher fetcher, MarkupExtractor extractor, Politeness politeness,
                            CrawlEventSink events, CrawlStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.politeness = (politeness != null) ? politeness : Politeness.NONE;
        this.events = (events != null) ? events : CrawlEventSink.NONE;
        this.stats = (stats != null) ? stats : new CrawlStats();
    }

    public List<ExtractionRecord> crawl(String startUrl, String dataSelector, PaginationStrategy strategy,
                                        int maxPages, CrawlScope scope) {
        return crawl(startUrl, dataSelector, strategy, maxPages, scope, CrawlControl.unbounded());
    }

    public List<ExtractionRecord> crawl(String startUrl, String dataSelector, PaginationStrategy strategy,
                                        int maxPages, CrawlScope scope, CrawlControl control) {
        Objects.requireNonNull(startUrl, "startUrl");
        Objects.requireNonNull(dataSelector, "dataSelector");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(control, "control");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");

        List<ExtractionRecord> records = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = startUrl;
        String reason;

        LOG.info("Paginated crawl start: {} (selector={}, maxPages={})", startUrl, dataSelector, maxPages);
        SLOG.info("paginated-start", "url", startUrl, "selector", dataSelector, "maxPages", maxPages);

        try {
            while (true) {
                if (control.isCancelled()) { reason = "cancelled"; break; }
                seen.add(UrlUtils.canonical(current));
                LOG.info("Crawling page {}: {}", records.size() + 1, current);

                PageResult result = fetcher.fetch(current);
                stats.addAttempts(result.attempts());
                if (result instanceof PageResult.Failed f) {
                    if (f.cause() == PageResult.Cause.PARSE) stats.parseFailed(); else stats.fetchFailed();
                    events.onPageFailed(current, f.cause().name(), f.detail());
                    reason = "fetch-failed";
                    break;
                }

                Page page = ((PageResult.Fetched) result).page();
                List<ExtractedElement> elements = extractor.select(page.getHtml(), page.sourceUrl(), dataSelector);
                if (elements.isEmpty()) {
                    LOG.error("No data found with selector: {} ({})", dataSelector, current);
                    reason = "no-data";
                    break;
                }
                records.add(new ExtractionRecord(current, elements));
                stats.pageCollected();
                events.onPageCollected(current, records.size());

                if (records.size() >= maxPages) { reason = "max-pages"; break; }

                NextStep step = strategy.next(page, current);
                if (step instanceof NextStep.Stop stop) {
                    LOG.info("Pagination stopped: {}", stop.reason());
                    reason = "end-of-pagination";
                    break;
                }
                String next = ((NextStep.Follow) step).url();
                Optional<String> rejected = ScopePolicy.rejectionReason(next, scope);
                if (rejected.isPresent()) {
                    stats.scopeRejected();
                    events.onScopeRejected(next, rejected.get());
                    reason = "out-of-scope";
                    break;
                }
                if (seen.contains(UrlUtils.canonical(next))) {
                    LOG.warn("Pagination loop detected at {}", next);
                    reason = "loop";
                    break;
                }
                politeness.afterFetch(UrlUtils.host(current));
                current = next;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            control.cancel();
            reason = "cancelled";
        }

        LOG.info("Paginated crawl done: pages={}, reason={}", records.size(), reason);
        SLOG.info("paginated-done", "pages", records.size(), "reason", reason);
        events.onFinished(reason, records.size());
        return records;
    }
}
