package com.seccrawl.core.scope;

import com.seccrawl.core.model.CrawlScope;
import com.seccrawl.core.util.UrlUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 후보 URL의 스코프 판정. 상태/IO 없는 순수 함수.
 * host가 allowedDomains 중 하나를 포함하고, 어떤 제외 정규식도 전체 URL에서 find 되지 않아야 통과.
 */
public final class ScopePolicy {
    private ScopePolicy() {}

    public static boolean isInScope(String candidateUrl, CrawlScope scope) {
        return rejectionReason(candidateUrl, scope).isEmpty();
    }

    /** 통과면 empty, 거부면 사유(로그용) */
    public static Optional<String> rejectionReason(String candidateUrl, CrawlScope scope) {
        if (candidateUrl == null || candidateUrl.isBlank()) return Optional.of("empty url");
        String host = UrlUtils.host(candidateUrl);
        if (host == null) return Optional.of("no host");

        boolean allowed = false;
        for (String d : scope.getAllowedDomains()) {
            if (host.contains(d)) { allowed = true; break; }
        }
        if (!allowed) return Optional.of("domain not allowed: " + host);

        for (Pattern p : scope.getExclusionPatterns()) {
            if (p.matcher(candidateUrl).find()) return Optional.of("excluded by " + p.pattern());
        }
        return Optional.empty();
    }
}
