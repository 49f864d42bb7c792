package com.seccrawl.core.model;

import com.seccrawl.core.error.ConfigurationException;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 크롤 허용 범위.
 * URL은 host가 allowedDomains 중 하나를 부분 문자열로 포함하고,
 * exclusionPatterns 중 어느 것도 전체 URL 문자열에서 find 되지 않을 때만 in-scope.
 *
 * <p>exclusionPatterns를 지정하지 않으면(null) {@link #DEFAULT_EXCLUDE_PATTERNS}를 쓴다:
 * <ul>
 *   <li>{@code \.(jpg|jpeg|png|gif|pdf|doc|docx|xls|xlsx)$} 바이너리/문서</li>
 *   <li>{@code \.(css|js)$} 스타일/스크립트</li>
 *   <li>{@code #.*$} fragment 가 붙은 URL</li>
 * </ul>
 * 빈 리스트를 넘기면 제외 규칙 없이 동작한다.
 */
public final class CrawlScope {

    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "\\.(jpg|jpeg|png|gif|pdf|doc|docx|xls|xlsx)$",
            "\\.(css|js)$",
            "#.*$"
    );

    private final Set<String> allowedDomains;
    private final List<Pattern> exclusionPatterns;

    private CrawlScope(Set<String> allowedDomains, List<Pattern> exclusionPatterns) {
        this.allowedDomains = Collections.unmodifiableSet(allowedDomains);
        this.exclusionPatterns = List.copyOf(exclusionPatterns);
    }

    /**
     * @param allowedDomains    host 부분 문자열 목록(비어있으면 안 됨)
     * @param excludePatterns   정규식 목록, null이면 기본 제외 규칙
     * @throws ConfigurationException 도메인이 없거나 정규식이 잘못된 경우
     */
    public static CrawlScope of(Collection<String> allowedDomains, List<String> excludePatterns) {
        Set<String> domains = new LinkedHashSet<>();
        if (allowedDomains != null) {
            for (String d : allowedDomains) {
                if (d != null && !d.isBlank()) domains.add(d.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (domains.isEmpty()) throw new ConfigurationException("allowedDomains must not be empty");
        return new CrawlScope(domains, compile(excludePatterns == null ? DEFAULT_EXCLUDE_PATTERNS : excludePatterns));
    }

    /** allowedDomains가 비어있으면 시작 URL의 host 하나만 허용. */
    public static CrawlScope forStart(URI startUrl, Collection<String> allowedDomains, List<String> excludePatterns) {
        if (allowedDomains == null || allowedDomains.stream().allMatch(d -> d == null || d.isBlank())) {
            String host = (startUrl == null) ? null : startUrl.getHost();
            if (host == null) throw new ConfigurationException("start URL has no host: " + startUrl);
            return of(List.of(host), excludePatterns);
        }
        return of(allowedDomains, excludePatterns);
    }

    public Set<String> getAllowedDomains() { return allowedDomains; }
    public List<Pattern> getExclusionPatterns() { return exclusionPatterns; }

    private static List<Pattern> compile(List<String> patterns) {
        List<Pattern> out = new ArrayList<>();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;
            try {
                out.add(Pattern.compile(p));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("invalid exclude pattern: " + p, e);
            }
        }
        return out;
    }

    @Override public String toString() {
        return "CrawlScope[domains=" + allowedDomains + ", excludes=" + exclusionPatterns + "]";
    }
}
