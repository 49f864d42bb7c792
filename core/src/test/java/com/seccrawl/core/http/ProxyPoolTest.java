package com.seccrawl.core.http;

import com.seccrawl.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProxyPoolTest {

    @Test
    void parses_host_port_and_http_forms() {
        var pool = ProxyPool.parse(List.of("127.0.0.1:8080", "http://proxy.local:3128", " "));
        assertThat(pool.endpoints()).hasSize(2);
        assertThat(pool.endpoints().get(0).getHostString()).isEqualTo("127.0.0.1");
        assertThat(pool.endpoints().get(1).getPort()).isEqualTo(3128);
    }

    @Test
    void missing_port_is_configuration_error() {
        assertThatThrownBy(() -> ProxyPool.parse(List.of("proxy.local")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void empty_pool_picks_nothing() {
        assertThat(ProxyPool.parse(List.of()).pick(new Random(1))).isEmpty();
        assertThat(ProxyPool.parse(null).isEmpty()).isTrue();
    }
}
