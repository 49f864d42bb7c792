package com.seccrawl.core.testing;

import com.seccrawl.core.util.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** 테스트용 Sleeper: 실제로 자지 않고 sleep(Duration) 호출만 기록 */
public final class RecordingSleeper implements Sleeper {
    public final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    @Override public void sleep(Duration d) { sleeps.add(d); }
}
