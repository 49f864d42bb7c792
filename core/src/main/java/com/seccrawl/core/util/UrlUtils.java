package com.seccrawl.core.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Locale;

/** URL 해석/정규화 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * base 기준으로 href를 절대 URL로 해석(표준 URL join).
     * scheme/host 상속, ./.. 세그먼트 정리, query/fragment 유지. 해석 불가면 null.
     */
    public static String resolve(String base, String href) {
        if (href == null) return null;
        String h = href.trim();
        if (h.isEmpty()) return base;
        URL abs;
        try {
            abs = (base == null || base.isBlank()) ? new URL(h) : new URL(new URL(base), h);
        } catch (MalformedURLException e) {
            return null;
        }
        try {
            // 남은 "." / ".." 세그먼트 정리
            return abs.toURI().normalize().toString();
        } catch (URISyntaxException e) {
            // 공백 등 URI 금지 문자가 섞인 링크는 URL 원문 그대로
            return abs.toExternalForm();
        }
    }

    /**
     * 방문 집합 키로 쓰는 정규 문자열.
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로
     * - query/fragment는 원문 유지
     * 파싱 불가면 trim 한 원문.
     */
    public static String canonical(String url) {
        if (url == null) return null;
        String s = url.trim();
        URI u;
        try {
            u = new URI(s);
        } catch (URISyntaxException e) {
            return s;
        }
        if (u.getScheme() == null || u.getRawAuthority() == null) return s;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost().toLowerCase(Locale.ROOT) : u.getRawAuthority().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) port = -1;

        StringBuilder sb = new StringBuilder(s.length());
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null && u.getHost() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port >= 0 && u.getHost() != null) sb.append(':').append(port);
        String path = u.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        if (u.getRawFragment() != null) sb.append('#').append(u.getRawFragment());
        return sb.toString();
    }

    /** 소문자 host. 없거나 파싱 불가면 null */
    public static String host(String url) {
        if (url == null) return null;
        try {
            String h = new URI(url.trim()).getHost();
            return h == null ? null : h.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
