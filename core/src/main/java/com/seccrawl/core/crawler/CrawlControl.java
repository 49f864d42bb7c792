package com.seccrawl.core.crawler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * 크롤 실행 취소 신호: 외부 취소 플래그 + (옵션) 마감 시각.
 * 한 fetch 가 끝나고 다음 fetch 를 시작하기 전에만 확인한다. 진행 중인 fetch 는 끝까지 간다.
 */
public final class CrawlControl {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final LongSupplier nanoClock;
    private final long deadlineNanos; // Long.MAX_VALUE 이면 무제한

    private CrawlControl(LongSupplier nanoClock, long deadlineNanos) {
        this.nanoClock = nanoClock;
        this.deadlineNanos = deadlineNanos;
    }

    public static CrawlControl unbounded() {
        return new CrawlControl(System::nanoTime, Long.MAX_VALUE);
    }

    /** deadline 이 0 이하이면 무제한 */
    public static CrawlControl withDeadline(Duration deadline) {
        return withDeadline(deadline, System::nanoTime);
    }

    static CrawlControl withDeadline(Duration deadline, LongSupplier nanoClock) {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) return new CrawlControl(nanoClock, Long.MAX_VALUE);
        return new CrawlControl(nanoClock, nanoClock.getAsLong() + deadline.toNanos());
    }

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() {
        if (cancelled.get()) return true;
        if (deadlineNanos != Long.MAX_VALUE && nanoClock.getAsLong() - deadlineNanos >= 0) {
            cancelled.set(true);
            return true;
        }
        return false;
    }
}
