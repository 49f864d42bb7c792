package com.seccrawl.core.error;

/**
 * 잘못된 설정(페이지네이션 조합, 출력 형식, 숫자 범위, 정규식 등).
 * 네트워크 작업 시작 전에 던져지며 재시도하지 않는다.
 */
public class ConfigurationException extends CrawlException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
