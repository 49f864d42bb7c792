package com.seccrawl.app;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.CrawlConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 명령행 플래그. 지정된 값만 CrawlConfig(crawl.yml 결과)에 덮어쓴다.
 * 첫 번째 위치 인자는 시작 URL 로 본다.
 */
final class CliOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: seccrawl [options] [startUrl]",
            "  --config <file>          crawl.yml 경로 (기본: ./crawl.yml 이 있으면 사용)",
            "  --url <url>              시작 URL",
            "  --max-pages <n>          최대 수집 페이지 수",
            "  --delay <seconds>        요청 간 지연 / 재시도 backoff 기준값",
            "  --max-retries <n>        요청당 최대 시도 수",
            "  --timeout <seconds>      요청 타임아웃",
            "  --proxy <host:port>      프록시 추가(반복 가능, 지정 시 프록시 사용)",
            "  --allowed-domain <d>     허용 도메인 추가(반복 가능)",
            "  --exclude <regex>        제외 패턴 추가(반복 가능, 기본 규칙 대체)",
            "  --data-selector <css>    페이지네이션 모드: 추출할 요소 (별칭 --selector)",
            "  --next-selector <css>    다음 페이지 링크 셀렉터",
            "  --page-param <name>      페이지 번호 쿼리 파라미터",
            "  --format <json|csv>      출력 형식",
            "  --output-dir <dir>       출력 디렉터리",
            "  --workers <n>            동시 워커 수(사이트 모드)",
            "  --deadline <seconds>     전체 실행 시간 제한(0 = 없음)",
            "  --no-redirects           리다이렉트를 따라가지 않음",
            "  -h, --help               도움말");

    Path configFile;
    boolean help;

    String url;
    Integer maxPages;
    Double delaySeconds;
    Integer maxRetries;
    Double timeoutSeconds;
    final List<String> proxies = new ArrayList<>();
    final List<String> allowedDomains = new ArrayList<>();
    final List<String> excludes = new ArrayList<>();
    String dataSelector;
    String nextSelector;
    String pageParam;
    String format;
    Path outputDir;
    Integer workers;
    Integer deadlineSeconds;
    boolean noRedirects;

    /** @throws ConfigurationException 알 수 없는 플래그, 값 누락, 숫자 형식 오류 */
    static CliOptions parse(String[] args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h", "--help" -> o.help = true;
                case "--config" -> o.configFile = Path.of(value(args, ++i, a));
                case "--url" -> o.url = value(args, ++i, a);
                case "--max-pages" -> o.maxPages = intValue(args, ++i, a);
                case "--delay" -> o.delaySeconds = doubleValue(args, ++i, a);
                case "--max-retries" -> o.maxRetries = intValue(args, ++i, a);
                case "--timeout" -> o.timeoutSeconds = doubleValue(args, ++i, a);
                case "--proxy" -> o.proxies.add(value(args, ++i, a));
                case "--allowed-domain" -> o.allowedDomains.add(value(args, ++i, a));
                case "--exclude" -> o.excludes.add(value(args, ++i, a));
                case "--selector", "--data-selector" -> o.dataSelector = value(args, ++i, a);
                case "--next-selector" -> o.nextSelector = value(args, ++i, a);
                case "--page-param" -> o.pageParam = value(args, ++i, a);
                case "--format" -> o.format = value(args, ++i, a);
                case "--output-dir" -> o.outputDir = Path.of(value(args, ++i, a));
                case "--workers" -> o.workers = intValue(args, ++i, a);
                case "--deadline" -> o.deadlineSeconds = intValue(args, ++i, a);
                case "--no-redirects" -> o.noRedirects = true;
                default -> {
                    if (a.startsWith("-")) throw new ConfigurationException("Unknown option: " + a);
                    if (o.url != null) throw new ConfigurationException("Unexpected argument: " + a);
                    o.url = a;
                }
            }
        }
        return o;
    }

    /** 지정된 플래그만 덮어쓴다(플래그 > crawl.yml > 기본값) */
    CrawlConfig applyTo(CrawlConfig cfg) {
        if (url != null) cfg.setStartUrl(url);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (delaySeconds != null) cfg.setDelaySeconds(delaySeconds);
        if (maxRetries != null) cfg.setMaxRetries(maxRetries);
        if (timeoutSeconds != null) cfg.setTimeoutSeconds(timeoutSeconds);
        if (!proxies.isEmpty()) cfg.setUseProxy(true).setProxyList(proxies);
        if (!allowedDomains.isEmpty()) cfg.setAllowedDomains(allowedDomains);
        if (!excludes.isEmpty()) cfg.setExcludePatterns(excludes);
        if (dataSelector != null) cfg.setDataSelector(dataSelector);
        if (nextSelector != null) cfg.setNextSelector(nextSelector);
        if (pageParam != null) cfg.setPageParam(pageParam);
        if (format != null) cfg.setOutputFormat(format);
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (workers != null) cfg.setWorkers(workers);
        if (deadlineSeconds != null) cfg.setDeadline(Duration.ofSeconds(deadlineSeconds));
        if (noRedirects) cfg.setFollowRedirects(false);
        return cfg;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new ConfigurationException(flag + " requires a value");
        return args[i];
    }

    private static int intValue(String[] args, int i, String flag) {
        String v = value(args, i, flag);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(flag + " must be an integer: " + v, e);
        }
    }

    private static double doubleValue(String[] args, int i, String flag) {
        String v = value(args, i, flag);
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(flag + " must be a number: " + v, e);
        }
    }
}
