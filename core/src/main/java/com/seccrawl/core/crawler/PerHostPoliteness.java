package com.seccrawl.core.crawler;

import com.seccrawl.core.util.Sleeper;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 멀티 워커용: 같은 host 에 대한 fetch 시작 간격을 delay 이상으로 벌린다.
 * 다른 host 로 가는 워커는 서로 막지 않는다. 슬롯 예약만 락 안에서 하고 대기는 락 밖에서.
 */
public final class PerHostPoliteness implements Politeness {
    private final long delayNanos;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private final Map<String, Long> nextSlot = new HashMap<>();

    public PerHostPoliteness(Duration delay, Sleeper sleeper) {
        this(delay, sleeper, System::nanoTime);
    }

    PerHostPoliteness(Duration delay, Sleeper sleeper, LongSupplier nanoClock) {
        this.delayNanos = Objects.requireNonNull(delay, "delay").toNanos();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    @Override public void beforeFetch(String host) throws InterruptedException {
        if (delayNanos <= 0) return;
        String key = (host == null) ? "" : host;
        long wait;
        synchronized (nextSlot) {
            long now = nanoClock.getAsLong();
            long slot = Math.max(now, nextSlot.getOrDefault(key, now));
            nextSlot.put(key, slot + delayNanos);
            wait = slot - now;
        }
        if (wait > 0) sleeper.sleep(Duration.ofNanos(wait));
    }
}
