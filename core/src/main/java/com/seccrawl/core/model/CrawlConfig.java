package com.seccrawl.core.model;

import com.seccrawl.core.error.ConfigurationException;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 크롤 설정 (crawl.yml / CLI 매핑 대상). 순수 설정 보관용.
 * dataSelector가 있으면 페이지네이션 크롤, 없으면 사이트 전체(frontier) 크롤.
 */
public final class CrawlConfig {

    /** 실행 모드(설정 조합에서 유도) */
    public enum Mode { SITE, PAGINATED }

    // ---------- 기본 필드 ----------
    private String startUrl;                              // 시작 URL (필수)
    private Duration delay = Duration.ofSeconds(1);       // 요청 간 politeness 지연, 재시도 backoff 기준값
    private int maxRetries = 3;                           // 요청당 최대 시도 수
    private Duration timeout = Duration.ofSeconds(10);    // 요청 타임아웃
    private boolean followRedirects = true;
    private boolean useProxy = false;
    private List<String> proxyList = List.of();
    private int maxPages = 100;
    private int workers = 1;                              // 1이면 단일 스레드
    private Duration deadline = Duration.ZERO;            // 0이면 무제한

    // ---------- 스코프 ----------
    private List<String> allowedDomains = List.of();      // 비어있으면 startUrl host
    private List<String> excludePatterns = null;          // null이면 CrawlScope 기본값

    // ---------- 페이지네이션 ----------
    private String dataSelector;
    private String nextSelector;
    private String pageParam;

    // ---------- 출력 ----------
    private OutputFormat outputFormat = OutputFormat.JSON;
    private Path outputDir = Path.of("out");

    // ---------- getters ----------
    public String getStartUrl() { return startUrl; }
    public Duration getDelay() { return delay; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public boolean isUseProxy() { return useProxy; }
    public List<String> getProxyList() { return proxyList; }
    public int getMaxPages() { return maxPages; }
    public int getWorkers() { return workers; }
    public Duration getDeadline() { return deadline; }
    public List<String> getAllowedDomains() { return allowedDomains; }
    public List<String> getExcludePatterns() { return excludePatterns; }
    public String getDataSelector() { return dataSelector; }
    public String getNextSelector() { return nextSelector; }
    public String getPageParam() { return pageParam; }
    public OutputFormat getOutputFormat() { return outputFormat; }
    public Path getOutputDir() { return outputDir; }

    public Mode getMode() { return isBlank(dataSelector) ? Mode.SITE : Mode.PAGINATED; }

    /** 프록시 사용 설정일 때만 목록 반환 */
    public List<String> effectiveProxies() { return useProxy ? proxyList : List.of(); }

    // ---------- fluent setters ----------
    public CrawlConfig setStartUrl(String v) { this.startUrl = v; return this; }
    public CrawlConfig setDelay(Duration v) { this.delay = v; return this; }
    public CrawlConfig setDelaySeconds(double seconds) {
        this.delay = Duration.ofMillis(Math.round(seconds * 1000.0));
        return this;
    }
    public CrawlConfig setMaxRetries(int v) { this.maxRetries = v; return this; }
    public CrawlConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public CrawlConfig setTimeoutSeconds(double seconds) {
        this.timeout = Duration.ofMillis(Math.round(seconds * 1000.0));
        return this;
    }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUseProxy(boolean v) { this.useProxy = v; return this; }
    public CrawlConfig setProxyList(List<String> v) { this.proxyList = (v == null ? List.of() : List.copyOf(v)); return this; }
    public CrawlConfig setMaxPages(int v) { this.maxPages = v; return this; }
    public CrawlConfig setWorkers(int v) { this.workers = v; return this; }
    public CrawlConfig setDeadline(Duration v) { this.deadline = (v == null ? Duration.ZERO : v); return this; }
    public CrawlConfig setAllowedDomains(List<String> v) { this.allowedDomains = (v == null ? List.of() : List.copyOf(v)); return this; }
    /** null이면 기본 제외 규칙, 빈 리스트면 제외 없음 */
    public CrawlConfig setExcludePatterns(List<String> v) { this.excludePatterns = (v == null ? null : List.copyOf(v)); return this; }
    public CrawlConfig setDataSelector(String v) { this.dataSelector = v; return this; }
    public CrawlConfig setNextSelector(String v) { this.nextSelector = v; return this; }
    public CrawlConfig setPageParam(String v) { this.pageParam = v; return this; }
    public CrawlConfig setOutputFormat(OutputFormat v) { this.outputFormat = v; return this; }
    public CrawlConfig setOutputFormat(String name) { this.outputFormat = OutputFormat.parse(name); return this; }
    public CrawlConfig setOutputDir(Path v) { this.outputDir = v; return this; }

    // ---------- validate ----------
    /** 네트워크 작업 전에 호출. 위반 시 ConfigurationException. */
    public void validate() {
        if (isBlank(startUrl)) throw new ConfigurationException("startUrl is required");
        URI start;
        try {
            start = URI.create(startUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("startUrl is not a valid URL: " + startUrl, e);
        }
        if (start.getScheme() == null || start.getHost() == null)
            throw new ConfigurationException("startUrl must be absolute: " + startUrl);

        if (delay == null || delay.isNegative()) throw new ConfigurationException("delay must be >= 0");
        if (maxRetries < 1) throw new ConfigurationException("maxRetries must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new ConfigurationException("timeout must be > 0");
        if (maxPages < 1) throw new ConfigurationException("maxPages must be >= 1");
        if (workers < 1) throw new ConfigurationException("workers must be >= 1");
        if (deadline.isNegative()) throw new ConfigurationException("deadline must be >= 0");
        if (useProxy && proxyList.isEmpty()) throw new ConfigurationException("useProxy requires a non-empty proxyList");

        if (!isBlank(nextSelector) && !isBlank(pageParam))
            throw new ConfigurationException("nextSelector and pageParam are mutually exclusive");
        if (getMode() == Mode.SITE && (!isBlank(nextSelector) || !isBlank(pageParam)))
            throw new ConfigurationException("pagination requires dataSelector");

        if (outputFormat == null) throw new ConfigurationException("outputFormat is required");
        if (outputDir == null) throw new ConfigurationException("outputDir is required");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public URI startUri() { return URI.create(startUrl.trim()); }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
