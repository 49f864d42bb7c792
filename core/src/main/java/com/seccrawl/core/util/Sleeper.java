package com.seccrawl.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 기록용 구현으로 바꿔 끼운다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
