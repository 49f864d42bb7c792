package com.seccrawl.core.crawler;

/** fetch 사이 예의상 지연. host 는 null 일 수 있다. */
public interface Politeness {
    default void beforeFetch(String host) throws InterruptedException {}
    default void afterFetch(String host) throws InterruptedException {}

    Politeness NONE = new Politeness() {};
}
