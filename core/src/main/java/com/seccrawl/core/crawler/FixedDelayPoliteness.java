package com.seccrawl.core.crawler;

import com.seccrawl.core.util.Sleeper;

import java.time.Duration;
import java.util.Objects;

/** 단일 스레드용: fetch 를 수행한 매 반복 뒤에 결과와 무관하게 delay 만큼 쉰다. */
public final class FixedDelayPoliteness implements Politeness {
    private final Duration delay;
    private final Sleeper sleeper;

    public FixedDelayPoliteness(Duration delay, Sleeper sleeper) {
        this.delay = Objects.requireNonNull(delay, "delay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override public void afterFetch(String host) throws InterruptedException {
        sleeper.sleep(delay);
    }
}
