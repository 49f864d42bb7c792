package com.seccrawl.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 카운터 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // 재시도 포함 시도 수
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicInteger pagesCollected = new AtomicInteger(0);
    private final AtomicInteger fetchFailures  = new AtomicInteger(0);
    private final AtomicInteger parseFailures  = new AtomicInteger(0);
    private final AtomicInteger scopeRejections = new AtomicInteger(0);

    public void addAttempts(int attempts) {
        requestsTotal.addAndGet(attempts);
        if (attempts > 1) retriesTotal.addAndGet(attempts - 1L);
    }
    public void pageCollected()  { pagesCollected.incrementAndGet(); }
    public void fetchFailed()    { fetchFailures.incrementAndGet(); }
    public void parseFailed()    { parseFailures.incrementAndGet(); }
    public void scopeRejected()  { scopeRejections.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(requestsTotal.get(), retriesTotal.get(), pagesCollected.get(),
                fetchFailures.get(), parseFailures.get(), scopeRejections.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(long requestsTotal, long retriesTotal, int pagesCollected,
                           int fetchFailures, int parseFailures, int scopeRejections) {}
}
