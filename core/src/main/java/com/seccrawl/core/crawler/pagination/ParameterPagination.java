package com.seccrawl.core.crawler.pagination;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.Page;
import com.seccrawl.core.util.UrlParamUtil;

import java.net.URI;

/**
 * 쿼리 파라미터 페이지 번호를 1씩 올린다(없으면 1 에서 시작). int 최댓값에 닿기 전에는 멈추지 않는다.
 * 키가 이미 있으면 같은 위치에서 값만 바꾸고, 없으면 맨 뒤에 붙인다.
 */
public final class ParameterPagination implements PaginationStrategy {

    private final String paramName;
    private int currentPageNumber;

    /** @throws ConfigurationException 시작 URL 의 파라미터 값이 정수가 아닐 때 */
    public ParameterPagination(String paramName, String startUrl) {
        if (paramName == null || paramName.isBlank()) {
            throw new ConfigurationException("pageParam must not be blank");
        }
        this.paramName = paramName;
        this.currentPageNumber = pageNumberOf(toUri(startUrl), paramName);
    }

    @Override
    public NextStep next(Page current, String currentUrl) {
        URI uri = toUri(currentUrl);
        int n = pageNumberOf(uri, paramName);
        if (n == Integer.MAX_VALUE) return NextStep.stop(paramName + " is already Integer.MAX_VALUE");
        currentPageNumber = n + 1;
        return NextStep.follow(UrlParamUtil.withParam(uri, paramName, Integer.toString(currentPageNumber)).toString());
    }

    public String paramName() { return paramName; }

    public int currentPageNumber() { return currentPageNumber; }

    static int pageNumberOf(URI uri, String paramName) {
        String raw = UrlParamUtil.parseQuery(uri).get(paramName);
        if (raw == null || raw.isEmpty()) return 1;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(paramName + " is not an integer: " + raw, e);
        }
    }

    private static URI toUri(String url) {
        if (url == null) throw new ConfigurationException("url is required for parameter pagination");
        try {
            return URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid url: " + url, e);
        }
    }
}
