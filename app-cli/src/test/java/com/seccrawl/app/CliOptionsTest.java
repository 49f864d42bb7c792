package com.seccrawl.app;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.CrawlConfig;
import com.seccrawl.core.model.OutputFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @Test
    void positional_url_and_flags_override_only_given_values() {
        CliOptions o = CliOptions.parse(new String[]{
                "https://ex.com/", "--max-pages", "7", "--delay", "0.5",
                "--proxy", "p1:8080", "--proxy", "p2:8080",
                "--format", "CSV", "--output-dir", "results", "--no-redirects"});

        CrawlConfig cfg = o.applyTo(CrawlConfig.defaults().setMaxRetries(5));

        assertThat(cfg.getStartUrl()).isEqualTo("https://ex.com/");
        assertThat(cfg.getMaxPages()).isEqualTo(7);
        assertThat(cfg.getDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(cfg.getMaxRetries()).isEqualTo(5); // 미지정 → 기존 값 유지
        assertThat(cfg.isUseProxy()).isTrue();
        assertThat(cfg.getProxyList()).containsExactly("p1:8080", "p2:8080");
        assertThat(cfg.getOutputFormat()).isEqualTo(OutputFormat.CSV);
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("results"));
        assertThat(cfg.isFollowRedirects()).isFalse();
    }

    @Test
    void pagination_flags() {
        CrawlConfig cfg = CliOptions.parse(new String[]{
                "--url", "https://ex.com/c?page=1", "--selector", ".comment", "--page-param", "page",
                "--exclude", "\\.pdf$", "--allowed-domain", "ex.com"})
                .applyTo(CrawlConfig.defaults());

        assertThat(cfg.getMode()).isEqualTo(CrawlConfig.Mode.PAGINATED);
        assertThat(cfg.getDataSelector()).isEqualTo(".comment");
        assertThat(cfg.getPageParam()).isEqualTo("page");
        assertThat(cfg.getExcludePatterns()).isEqualTo(List.of("\\.pdf$"));
        assertThat(cfg.getAllowedDomains()).containsExactly("ex.com");
    }

    @Test
    void invalid_arguments() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--bogus"}))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("--bogus");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--max-pages"}))
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("requires a value");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--workers", "many"}))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"https://a/", "https://b/"}))
                .isInstanceOf(ConfigurationException.class);
    }
}
