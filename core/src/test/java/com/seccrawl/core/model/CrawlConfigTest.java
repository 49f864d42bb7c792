package com.seccrawl.core.model;

import com.seccrawl.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    private static CrawlConfig valid() {
        return CrawlConfig.defaults().setStartUrl("https://example.com/");
    }

    @Test
    void defaults() {
        var c = CrawlConfig.defaults();
        assertThat(c.getDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(c.getMaxRetries()).isEqualTo(3);
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.getMaxPages()).isEqualTo(100);
        assertThat(c.getWorkers()).isEqualTo(1);
        assertThat(c.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(c.getOutputDir()).isEqualTo(Path.of("out"));
        assertThat(c.getExcludePatterns()).isNull();
        assertThat(c.getMode()).isEqualTo(CrawlConfig.Mode.SITE);
        assertThatCode(() -> valid().validate()).doesNotThrowAnyException();
    }

    @Test
    void start_url_is_required_and_absolute() {
        assertThatThrownBy(() -> CrawlConfig.defaults().validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CrawlConfig.defaults().setStartUrl("/relative").validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CrawlConfig.defaults().setStartUrl("http://bad url").validate())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void numeric_bounds() {
        assertThatThrownBy(() -> valid().setDelaySeconds(-1).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> valid().setMaxRetries(0).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> valid().setTimeoutSeconds(0).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> valid().setMaxPages(0).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> valid().setWorkers(0).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> valid().setDeadline(Duration.ofSeconds(-1)).validate()).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void proxy_flag_requires_list() {
        assertThatThrownBy(() -> valid().setUseProxy(true).validate()).isInstanceOf(ConfigurationException.class);
        var c = valid().setProxyList(List.of("127.0.0.1:8080"));
        assertThat(c.effectiveProxies()).isEmpty();
        assertThat(c.setUseProxy(true).effectiveProxies()).containsExactly("127.0.0.1:8080");
    }

    @Test
    void pagination_options() {
        assertThatThrownBy(() -> valid().setDataSelector(".x").setNextSelector("a").setPageParam("p").validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> valid().setPageParam("p").validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("dataSelector");
        assertThat(valid().setDataSelector(".x").getMode()).isEqualTo(CrawlConfig.Mode.PAGINATED);
    }

    @Test
    void output_format_names() {
        assertThat(valid().setOutputFormat("CSV").getOutputFormat()).isEqualTo(OutputFormat.CSV);
        assertThatThrownBy(() -> valid().setOutputFormat("xml")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fractional_seconds_are_kept() {
        assertThat(valid().setDelaySeconds(0.25).getDelay()).isEqualTo(Duration.ofMillis(250));
    }
}
