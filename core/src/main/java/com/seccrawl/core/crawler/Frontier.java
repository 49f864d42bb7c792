package com.seccrawl.core.crawler;

import com.seccrawl.core.api.CrawlEventSink;
import com.seccrawl.core.model.CrawlScope;
import com.seccrawl.core.model.CrawlStats;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.scope.ScopePolicy;
import com.seccrawl.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 사이트 크롤 상태(visited / pending / collected). 크롤 실행 1회가 독점한다.
 *
 * <p>불변식
 * <ul>
 *   <li>visited ∩ pending = ∅, pending 에는 visited/진행중/실패 URL 을 넣지 않는다</li>
 *   <li>한 URL 은 두 번 claim 되지 않고, 같은 도착 URL 의 페이지는 한 번만 수집된다</li>
 *   <li>collected.size() + 진행중 ≤ maxPages (동시 완료 시에도)</li>
 * </ul>
 * pending 은 FIFO(BFS) 큐다. 모든 변경은 이 객체의 모니터 아래에서만 일어난다.
 * URL 은 {@link UrlUtils#canonical(String)} 형태로 보관한다.
 */
public final class Frontier {

    private final Deque<String> pending = new ArrayDeque<>();
    private final Set<String> pendingSet = new HashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Set<String> failed = new HashSet<>();
    private final List<Page> collected = new ArrayList<>();
    private final Set<String> collectedUrls = new HashSet<>(); // 수집한 페이지의 도착 URL(canonical)

    private final int maxPages;
    private final CrawlScope scope;
    private final CrawlEventSink events;
    private final CrawlStats stats;

    public Frontier(String startUrl, int maxPages, CrawlScope scope, CrawlEventSink events, CrawlStats stats) {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.maxPages = maxPages;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.events = (events != null) ? events : CrawlEventSink.NONE;
        this.stats = (stats != null) ? stats : new CrawlStats();
        offer(UrlUtils.canonical(Objects.requireNonNull(startUrl, "startUrl")));
    }

    /**
     * 다음으로 가져올 URL 을 예약한다. pending 이 비었지만 진행중인 fetch 가 있으면
     * 새 링크가 들어오거나 모두 끝날 때까지 기다린다.
     * @return 더 할 일이 없거나(빈 pending, 예산 소진) 취소되면 empty
     */
    public synchronized Optional<String> claim(CrawlControl control) throws InterruptedException {
        while (true) {
            if (control.isCancelled() || collected.size() >= maxPages) return Optional.empty();

            if (pending.isEmpty() || collected.size() + inFlight.size() >= maxPages) {
                if (inFlight.isEmpty()) return Optional.empty();
                wait(100); // 취소/마감 재확인 주기
                continue;
            }

            String url = pending.pollFirst();
            pendingSet.remove(url);
            if (visited.contains(url) || failed.contains(url) || inFlight.contains(url)) continue;

            Optional<String> rejected = ScopePolicy.rejectionReason(url, scope);
            if (rejected.isPresent()) {
                stats.scopeRejected();
                events.onScopeRejected(url, rejected.get());
                continue;
            }
            inFlight.add(url);
            return Optional.of(url);
        }
    }

    /** claim 한 URL 의 fetch 결과 반영. 성공이면 수집 + 링크 확장, 실패면 누락 처리. */
    public synchronized void complete(String url, PageResult result) {
        try {
            if (!inFlight.remove(url)) throw new IllegalStateException("not claimed: " + url);
            stats.addAttempts(result.attempts());

            if (result instanceof PageResult.Failed f) {
                failed.add(url);
                if (f.cause() == PageResult.Cause.PARSE) stats.parseFailed(); else stats.fetchFailed();
                events.onPageFailed(url, f.cause().name(), f.detail());
                return;
            }

            Page page = ((PageResult.Fetched) result).page();
            visited.add(url);
            String landed = UrlUtils.canonical(page.sourceUrl());
            if (!landed.equals(url)) {
                visited.add(landed);
                if (pendingSet.remove(landed)) pending.remove(landed);
            }
            // 같은 도착 URL 은 한 번만 수집. 다른 워커의 리다이렉트가 먼저 가져갔을 수 있다
            if (collectedUrls.contains(landed)) return;
            if (collected.size() >= maxPages) return;

            collectedUrls.add(landed);
            collected.add(page);
            stats.pageCollected();
            events.onPageCollected(page.sourceUrl(), collected.size());
            for (String link : page.getLinks()) offer(UrlUtils.canonical(link));
        } finally {
            notifyAll();
        }
    }

    private void offer(String url) {
        if (url == null || url.isEmpty()) return;
        if (visited.contains(url) || inFlight.contains(url) || failed.contains(url)) return;
        if (pendingSet.add(url)) pending.addLast(url);
    }

    // ---------- 조회 ----------
    public synchronized List<Page> collected() { return List.copyOf(collected); }
    public synchronized Set<String> visited() { return Collections.unmodifiableSet(new LinkedHashSet<>(visited)); }
    public synchronized List<String> pending() { return List.copyOf(pending); }
    public synchronized int inFlightCount() { return inFlight.size(); }
    public synchronized boolean budgetReached() { return collected.size() >= maxPages; }
    public int maxPages() { return maxPages; }
}
