package com.seccrawl.core.http;

import com.seccrawl.core.model.FetchRequest;
import com.seccrawl.core.util.UrlParamUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * java.net.http.HttpClient 기반 전송. 프록시별로 클라이언트를 하나씩 만들어 캐시한다.
 * HttpClient가 직접 설정을 금지하는 헤더(Connection 등)는 보내지 않는다.
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);
    private static final Set<String> RESTRICTED = Set.of("connection", "content-length", "expect", "host", "upgrade");
    private static final String DIRECT = "direct";

    private final Duration connectTimeout;
    private final boolean followRedirects;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public JdkHttpTransport(Duration connectTimeout, boolean followRedirects) {
        this.connectTimeout = connectTimeout;
        this.followRedirects = followRedirects;
    }

    @Override
    public TransportResponse send(FetchRequest request, Map<String, String> headers,
                                  InetSocketAddress proxy, Duration timeout) throws IOException, InterruptedException {
        URI target = UrlParamUtil.withParams(request.getUrl(), request.getQueryParams());

        HttpRequest.Builder b = HttpRequest.newBuilder(target).timeout(timeout);
        for (var e : headers.entrySet()) {
            if (RESTRICTED.contains(e.getKey().toLowerCase(Locale.ROOT))) continue;
            b.setHeader(e.getKey(), e.getValue());
        }
        if (request.hasBody()) {
            if (headers.keySet().stream().noneMatch(k -> k.equalsIgnoreCase("Content-Type"))) {
                b.setHeader("Content-Type", "application/x-www-form-urlencoded");
            }
            b.method(request.getMethod(), HttpRequest.BodyPublishers.ofString(UrlParamUtil.buildQuery(request.getFormFields())));
        } else {
            b.method(request.getMethod(), HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> resp = client(proxy).send(b.build(), HttpResponse.BodyHandlers.ofString());
        LOG.debug("{} {} -> {}", request.getMethod(), target, resp.statusCode());
        return new TransportResponse(resp.statusCode(), resp.headers().map(),
                resp.body() == null ? "" : resp.body(), resp.uri());
    }

    private HttpClient client(InetSocketAddress proxy) {
        String key = (proxy == null) ? DIRECT : proxy.getHostString() + ":" + proxy.getPort();
        return clients.computeIfAbsent(key, k -> {
            HttpClient.Builder cb = HttpClient.newBuilder()
                    .followRedirects(followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                    .connectTimeout(connectTimeout);
            if (proxy != null) cb.proxy(ProxySelector.of(proxy));
            return cb.build();
        });
    }
}
