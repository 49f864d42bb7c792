package com.seccrawl.core.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * URL 쿼리 파라미터 유틸 (Java 17)
 * - parseQuery: 단일값 맵(같은 키는 마지막 값, 위치는 처음 등장 위치)
 * - withParam: key를 제자리에서 교체(없으면 끝에 추가)하고 쿼리 전체를 재인코딩
 * - withParams: 여러 키를 같은 규칙으로 반영
 */
public final class UrlParamUtil {
    private UrlParamUtil() {}

    /** 단일값 쿼리 파싱(마지막 값을 채택). 입력 순서 유지. */
    public static Map<String, String> parseQuery(URI url) {
        Objects.requireNonNull(url, "url");
        Map<String, String> m = new LinkedHashMap<>();
        String q = url.getRawQuery();
        if (q == null || q.isEmpty()) return m;

        for (String p : q.split("&")) {
            if (p.isEmpty()) continue;
            int i = p.indexOf('=');
            String k = dec(i < 0 ? p : p.substring(0, i));
            String v = (i < 0) ? "" : dec(p.substring(i + 1));
            m.put(k, v);
        }
        return m;
    }

    /** key=value 반영. 기존 key면 같은 위치에서 값만 교체. */
    public static URI withParam(URI base, String key, String value) {
        Objects.requireNonNull(base, "base");
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        return withParams(base, Map.of(key, value == null ? "" : value));
    }

    /** add의 각 항목을 withParam 규칙으로 반영(입력 순서대로). */
    public static URI withParams(URI base, Map<String, String> add) {
        Objects.requireNonNull(base, "base");
        if (add == null || add.isEmpty()) return base;
        Map<String, String> merged = parseQuery(base);
        add.forEach((k, v) -> merged.put(k, v == null ? "" : v));
        return rebuild(base, buildQuery(merged));
    }

    /** application/x-www-form-urlencoded 인코딩(폼 본문에도 사용) */
    public static String buildQuery(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (var e : params.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            sb.append(enc(e.getKey())).append('=').append(enc(e.getValue() == null ? "" : e.getValue()));
        }
        return sb.toString();
    }

    // ---------- helpers ----------
    private static String enc(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }
    private static String dec(String s) { return URLDecoder.decode(s, StandardCharsets.UTF_8); }

    /** raw 컴포넌트로 재조립(이미 인코딩된 경로/프래그먼트를 이중 인코딩하지 않음) */
    private static URI rebuild(URI base, String newQuery) {
        StringBuilder sb = new StringBuilder();
        if (base.getScheme() != null) sb.append(base.getScheme()).append(':');
        if (base.getRawAuthority() != null) sb.append("//").append(base.getRawAuthority());
        String path = base.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);
        if (newQuery != null && !newQuery.isEmpty()) sb.append('?').append(newQuery);
        if (base.getRawFragment() != null) sb.append('#').append(base.getRawFragment());
        return URI.create(sb.toString());
    }
}
