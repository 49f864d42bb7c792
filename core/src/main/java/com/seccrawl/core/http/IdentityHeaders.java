package com.seccrawl.core.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** 시도마다 새로 뽑는 브라우저 식별 헤더: 순환 User-Agent + 고정 템플릿. */
public final class IdentityHeaders {

    public static final List<String> DEFAULT_USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 Firefox/125.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:124.0) Gecko/20100101 Firefox/124.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36 Edg/124.0.2478.67",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_4 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Mobile/15E148 Safari/604.1"
    );

    private static final Map<String, String> TEMPLATE = templateHeaders();

    private final List<String> userAgents;

    public IdentityHeaders() { this(DEFAULT_USER_AGENTS); }

    public IdentityHeaders(List<String> userAgents) {
        if (userAgents == null || userAgents.isEmpty()) throw new IllegalArgumentException("userAgents must not be empty");
        this.userAgents = List.copyOf(userAgents);
    }

    /** 새 헤더 맵(호출자가 수정해도 됨) */
    public Map<String, String> next(Random random) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", userAgents.get(random.nextInt(userAgents.size())));
        h.putAll(TEMPLATE);
        return h;
    }

    public List<String> userAgents() { return userAgents; }

    private static Map<String, String> templateHeaders() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        m.put("Accept-Language", "zh-CN,zh;q=0.8,en;q=0.6");
        m.put("Connection", "keep-alive");
        m.put("Upgrade-Insecure-Requests", "1");
        return m;
    }
}
