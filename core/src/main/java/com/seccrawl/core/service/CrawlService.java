package com.seccrawl.core.service;

import com.seccrawl.core.api.CrawlEventSink;
import com.seccrawl.core.api.IPageFetcher;
import com.seccrawl.core.crawler.CrawlControl;
import com.seccrawl.core.crawler.FixedDelayPoliteness;
import com.seccrawl.core.crawler.LoggingCrawlEventSink;
import com.seccrawl.core.crawler.PageFetcher;
import com.seccrawl.core.crawler.PaginatedCrawler;
import com.seccrawl.core.crawler.PerHostPoliteness;
import com.seccrawl.core.crawler.Politeness;
import com.seccrawl.core.crawler.SiteCrawler;
import com.seccrawl.core.crawler.pagination.PaginationStrategy;
import com.seccrawl.core.http.RequestExecutor;
import com.seccrawl.core.model.CrawlConfig;
import com.seccrawl.core.model.CrawlRecord;
import com.seccrawl.core.model.CrawlScope;
import com.seccrawl.core.model.CrawlStats;
import com.seccrawl.core.parse.JsoupMarkupExtractor;
import com.seccrawl.core.parse.MarkupExtractor;
import com.seccrawl.core.sink.ResultSink;
import com.seccrawl.core.util.DefaultSleeper;
import com.seccrawl.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 오케스트레이터:
 *  - 설정 검증(네트워크 전에) → 사이트/페이지네이션 크롤 → 결과 저장
 *  - 기본 구현체(RequestExecutor/JsoupMarkupExtractor/ResultSink)
 *  - DI 생성자는 테스트 주입용
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final MarkupExtractor extractor;
    private final Politeness politeness;
    private final ResultSink sink;
    private final CrawlEventSink events;
    private final CrawlStats stats = new CrawlStats();
    private final CrawlScope scope;
    private final PaginationStrategy pagination; // SITE 모드면 null

    /** 기본 구성 */
    public CrawlService(CrawlConfig config) {
        this(config, new LoggingCrawlEventSink());
    }

    public CrawlService(CrawlConfig config, CrawlEventSink events) {
        this(validated(config), events, new JsoupMarkupExtractor());
    }

    private CrawlService(CrawlConfig config, CrawlEventSink events, MarkupExtractor extractor) {
        this(config, new PageFetcher(new RequestExecutor(config, events), extractor), extractor,
                defaultPoliteness(config), new ResultSink(), events);
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, MarkupExtractor extractor,
                        Politeness politeness, ResultSink sink, CrawlEventSink events) {
        this.config = validated(config);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.politeness = (politeness != null) ? politeness : Politeness.NONE;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = (events != null) ? events : CrawlEventSink.NONE;

        // 스코프/셀렉터/페이지 파라미터도 네트워크 전에 확인
        this.scope = CrawlScope.forStart(config.startUri(), config.getAllowedDomains(), config.getExcludePatterns());
        if (config.getMode() == CrawlConfig.Mode.PAGINATED) {
            extractor.select("", config.getStartUrl(), config.getDataSelector());
            this.pagination = PaginationStrategy.from(config, extractor);
        } else {
            this.pagination = null;
        }
    }

    /** 크롤만 실행(저장 없음) */
    public List<? extends CrawlRecord> crawl(CrawlControl control) {
        Objects.requireNonNull(control, "control");
        String start = config.startUri().toString();
        LOG.info("Crawl start: mode={}, url={}, maxPages={}", config.getMode(), start, config.getMaxPages());
        SLOG.info("crawl-start",
                "mode", String.valueOf(config.getMode()),
                "url", start,
                "maxPages", config.getMaxPages(),
                "workers", config.getWorkers());

        if (config.getMode() == CrawlConfig.Mode.PAGINATED) {
            return new PaginatedCrawler(fetcher, extractor, politeness, events, stats)
                    .crawl(start, config.getDataSelector(), pagination, config.getMaxPages(), scope, control);
        }
        return new SiteCrawler(fetcher, politeness, config.getWorkers(), events, stats)
                .crawl(start, config.getMaxPages(), scope, control);
    }

    /** 크롤 + 저장 */
    public CrawlReport run() throws IOException {
        return run(CrawlControl.withDeadline(config.getDeadline()));
    }

    public CrawlReport run(CrawlControl control) throws IOException {
        List<? extends CrawlRecord> records = crawl(control);
        Path out = sink.serialize(records, config.getOutputDir(), config.getOutputFormat());
        CrawlStats.Snapshot snap = stats.snapshot();
        LOG.info("Crawl done. records={}, output={}", records.size(), out);
        SLOG.info("crawl-done",
                "records", records.size(),
                "output", String.valueOf(out),
                "requests", snap.requestsTotal(),
                "retries", snap.retriesTotal(),
                "fetchFailures", snap.fetchFailures());
        return new CrawlReport(config.getMode(), records, out, snap);
    }

    public CrawlStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    public CrawlScope scope() { return scope; }

    // ---------- helpers ----------
    private static CrawlConfig validated(CrawlConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    /** 단일 워커: 매 fetch 뒤 고정 지연, 멀티 워커: 호스트별 간격 */
    static Politeness defaultPoliteness(CrawlConfig config) {
        if (config.getDelay().isZero()) return Politeness.NONE;
        return (config.getWorkers() > 1)
                ? new PerHostPoliteness(config.getDelay(), DefaultSleeper.INSTANCE)
                : new FixedDelayPoliteness(config.getDelay(), DefaultSleeper.INSTANCE);
    }
}
