package com.seccrawl.core.scope;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.CrawlScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopePolicyTest {

    @Nested
    @DisplayName("허용 도메인 example.com + 제외 \\.pdf$")
    class ExplicitScope {
        final CrawlScope scope = CrawlScope.of(List.of("example.com"), List.of("\\.pdf$"));

        @Test void pdf_is_rejected() {
            assertThat(ScopePolicy.isInScope("https://example.com/a.pdf", scope)).isFalse();
            assertThat(ScopePolicy.rejectionReason("https://example.com/a.pdf", scope)).get().asString()
                    .startsWith("excluded by");
        }

        @Test void html_is_accepted() {
            assertThat(ScopePolicy.isInScope("https://example.com/a.html", scope)).isTrue();
        }

        @Test void other_domain_is_rejected() {
            assertThat(ScopePolicy.isInScope("https://other.com/a.html", scope)).isFalse();
        }

        @Test void subdomain_matches_by_substring() {
            assertThat(ScopePolicy.isInScope("https://blog.example.com/post", scope)).isTrue();
        }
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 결과(상태 없음)")
    void check_is_idempotent() {
        var scope = CrawlScope.of(List.of("example.com"), null);
        for (int i = 0; i < 3; i++) {
            assertThat(ScopePolicy.isInScope("https://example.com/x", scope)).isTrue();
            assertThat(ScopePolicy.isInScope("https://example.com/x.css", scope)).isFalse();
        }
    }

    @Test
    void default_excludes_cover_assets_documents_and_fragments() {
        var scope = CrawlScope.forStart(URI.create("https://example.com/"), List.of(), null);
        assertThat(scope.getAllowedDomains()).containsExactly("example.com");
        assertThat(ScopePolicy.isInScope("https://example.com/img.JPG", scope)).isTrue(); // 대소문자 구분
        assertThat(ScopePolicy.isInScope("https://example.com/img.jpg", scope)).isFalse();
        assertThat(ScopePolicy.isInScope("https://example.com/report.xlsx", scope)).isFalse();
        assertThat(ScopePolicy.isInScope("https://example.com/app.js", scope)).isFalse();
        assertThat(ScopePolicy.isInScope("https://example.com/page#top", scope)).isFalse();
        assertThat(ScopePolicy.isInScope("https://example.com/page", scope)).isTrue();
    }

    @Test
    void empty_exclude_list_disables_exclusions() {
        var scope = CrawlScope.of(List.of("example.com"), List.of());
        assertThat(ScopePolicy.isInScope("https://example.com/a.pdf", scope)).isTrue();
    }

    @Test
    void url_without_host_is_out_of_scope() {
        var scope = CrawlScope.of(List.of("example.com"), List.of());
        assertThat(ScopePolicy.isInScope("mailto:someone@example.com", scope)).isFalse();
        assertThat(ScopePolicy.isInScope("/relative/path", scope)).isFalse();
        assertThat(ScopePolicy.isInScope("", scope)).isFalse();
    }

    @Test
    void invalid_regex_fails_at_construction() {
        assertThatThrownBy(() -> CrawlScope.of(List.of("example.com"), List.of("(unclosed")))
                .isInstanceOf(ConfigurationException.class);
    }
}
