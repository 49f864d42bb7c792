package com.seccrawl.core.http;

import com.seccrawl.core.api.CrawlEventSink;
import com.seccrawl.core.error.TransportException;
import com.seccrawl.core.model.CrawlConfig;
import com.seccrawl.core.model.FailureKind;
import com.seccrawl.core.model.FetchOutcome;
import com.seccrawl.core.model.FetchRequest;
import com.seccrawl.core.util.DefaultSleeper;
import com.seccrawl.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * HTTP 요청 1건 실행기: 시도마다 랜덤 식별 헤더 + (옵션) 랜덤 프록시, 선형 backoff 재시도.
 * - 전송 오류/타임아웃/비 2xx·3xx 는 모두 실패로 보고 baseDelay × attempt 만큼 쉰 뒤 재시도
 * - 마지막 시도 뒤에는 쉬지 않는다
 * - 공유 상태를 바꾸지 않으므로 재시도는 호출자 관점에서 멱등
 * - backoff 대기는 호출 스레드에서만 일어난다
 */
public class RequestExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RequestExecutor.class);

    private final HttpTransport transport;
    private final IdentityHeaders identity;
    private final Random random;
    private final Sleeper sleeper;
    private final CrawlEventSink events;

    // execute(FetchRequest) 기본값
    private final int defaultMaxRetries;
    private final Duration defaultBaseDelay;
    private final Duration defaultTimeout;
    private final ProxyPool defaultProxies;

    /** 설정 기반 기본 구성 */
    public RequestExecutor(CrawlConfig config, CrawlEventSink events) {
        this(new JdkHttpTransport(config.getTimeout(), config.isFollowRedirects()),
                new IdentityHeaders(), new Random(), DefaultSleeper.INSTANCE, events,
                config.getMaxRetries(), config.getDelay(), config.getTimeout(),
                ProxyPool.parse(config.effectiveProxies()));
    }

    /** DI/테스트용: Random 시드와 Sleeper를 고정해 재시도 시나리오를 재현 */
    public RequestExecutor(HttpTransport transport, IdentityHeaders identity, Random random, Sleeper sleeper,
                           CrawlEventSink events, int maxRetries, Duration baseDelay, Duration timeout,
                           ProxyPool proxies) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.random = Objects.requireNonNull(random, "random");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.events = (events != null) ? events : CrawlEventSink.NONE;
        this.defaultMaxRetries = Math.max(1, maxRetries);
        this.defaultBaseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.defaultTimeout = Objects.requireNonNull(timeout, "timeout");
        this.defaultProxies = (proxies != null) ? proxies : ProxyPool.EMPTY;
    }

    public FetchOutcome execute(FetchRequest request) {
        return execute(request, defaultMaxRetries, defaultBaseDelay, defaultTimeout, defaultProxies);
    }

    public FetchOutcome execute(FetchRequest request, int maxRetries, Duration baseDelay,
                                Duration timeout, ProxyPool proxyPool) {
        return execute(request, new LinearRetryPolicy(maxRetries, baseDelay), timeout, proxyPool);
    }

    /** 정책 주입 버전 */
    public FetchOutcome execute(FetchRequest request, RetryPolicy policy, Duration timeout, ProxyPool proxyPool) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(policy, "policy");
        final ProxyPool proxies = (proxyPool != null) ? proxyPool : ProxyPool.EMPTY;
        final URI url = request.getUrl();

        int attempt = 1;
        while (true) {
            Map<String, String> headers = nextHeaders(request);
            InetSocketAddress proxy = proxies.pick(random).orElse(null);
            events.onAttempt(url, attempt, proxy);

            int status;
            TransportException failure;
            try {
                HttpTransport.TransportResponse r = transport.send(request, headers, proxy, timeout);
                status = r.status();
                if (RetryPolicy.isSuccess(status)) {
                    URI finalUrl = (r.uri() != null) ? r.uri() : url;
                    return new FetchOutcome.Success(status, r.headers(), r.body(), finalUrl, attempt);
                }
                failure = new TransportException(status);
            } catch (IOException | RuntimeException e) {
                status = -1;
                failure = new TransportException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new FetchOutcome.Failure(FailureKind.INTERRUPTED, attempt, "interrupted");
            }

            LOG.warn("Request failed (attempt {}/{}): {} - {}", attempt, policy.maxAttempts(), url, failure.getMessage());
            if (!policy.shouldRetry(status, attempt)) {
                LOG.error("Max retries reached for URL: {}", url);
                events.onExhausted(url, attempt, failure.getMessage());
                return new FetchOutcome.Failure(FailureKind.EXHAUSTED, attempt, failure.getMessage());
            }

            Duration backoff = policy.nextDelay(attempt);
            events.onRetry(url, attempt, backoff, failure);
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new FetchOutcome.Failure(FailureKind.INTERRUPTED, attempt, "interrupted during backoff");
            }
            attempt++;
        }
    }

    private Map<String, String> nextHeaders(FetchRequest request) {
        Map<String, String> h = identity.next(random);
        request.getHeaderOverrides().forEach((k, v) -> {
            h.keySet().removeIf(existing -> existing.equalsIgnoreCase(k));
            h.put(k, v);
        });
        return h;
    }
}
