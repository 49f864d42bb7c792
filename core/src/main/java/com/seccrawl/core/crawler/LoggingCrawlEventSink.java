package com.seccrawl.core.crawler;

import com.seccrawl.core.api.CrawlEventSink;
import com.seccrawl.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;

/** 기본 이벤트 수신자: SLF4J + 구조화 로그. */
public class LoggingCrawlEventSink implements CrawlEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingCrawlEventSink.class);
    private static final StructuredLog SLOG = StructuredLog.get(LoggingCrawlEventSink.class);

    @Override
    public void onAttempt(URI url, int attempt, InetSocketAddress proxy) {
        LOG.debug("Fetch {} (attempt {}, proxy={})", url, attempt, proxy == null ? "direct" : proxy);
    }

    @Override
    public void onRetry(URI url, int attempt, Duration backoff, Exception cause) {
        SLOG.warn("fetch-retry",
                "url", String.valueOf(url),
                "attempt", attempt,
                "backoffMs", backoff.toMillis(),
                "cause", String.valueOf(cause.getMessage()));
    }

    @Override
    public void onExhausted(URI url, int attempts, String lastError) {
        SLOG.warn("fetch-exhausted", "url", String.valueOf(url), "attempts", attempts, "lastError", lastError);
    }

    @Override
    public void onScopeRejected(String url, String reason) {
        LOG.debug("Out of scope: {} ({})", url, reason);
    }

    @Override
    public void onPageCollected(String url, int collected) {
        LOG.info("Collected #{}: {}", collected, url);
        SLOG.info("page-collected", "url", url, "pageNo", collected);
    }

    @Override
    public void onPageFailed(String url, String cause, String detail) {
        LOG.warn("Skipped {} [{}]: {}", url, cause, detail);
        SLOG.warn("page-failed", "url", url, "cause", cause, "detail", detail);
    }

    @Override
    public void onFinished(String reason, int collected) {
        SLOG.info("run-finished", "reason", reason, "collected", collected);
    }
}
