package com.seccrawl.core.http;

import com.seccrawl.core.error.ConfigurationException;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/** 프록시 엔드포인트 목록. 시도마다 독립적으로 균등 랜덤 선택. */
public final class ProxyPool {

    public static final ProxyPool EMPTY = new ProxyPool(List.of());

    private final List<InetSocketAddress> endpoints;

    private ProxyPool(List<InetSocketAddress> endpoints) {
        this.endpoints = List.copyOf(endpoints);
    }

    /**
     * "host:port" 또는 "http://host:port" 형식.
     * @throws ConfigurationException 형식이 잘못된 항목이 있으면
     */
    public static ProxyPool parse(List<String> specs) {
        if (specs == null || specs.isEmpty()) return EMPTY;
        List<InetSocketAddress> out = new ArrayList<>();
        for (String s : specs) {
            if (s == null || s.isBlank()) continue;
            String t = s.trim();
            URI u;
            try {
                u = URI.create(t.contains("://") ? t : "http://" + t);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("invalid proxy endpoint: " + s, e);
            }
            if (u.getHost() == null || u.getPort() < 0)
                throw new ConfigurationException("proxy endpoint needs host:port: " + s);
            out.add(InetSocketAddress.createUnresolved(u.getHost(), u.getPort()));
        }
        return out.isEmpty() ? EMPTY : new ProxyPool(out);
    }

    public static ProxyPool of(List<InetSocketAddress> endpoints) {
        return (endpoints == null || endpoints.isEmpty()) ? EMPTY : new ProxyPool(endpoints);
    }

    public Optional<InetSocketAddress> pick(Random random) {
        if (endpoints.isEmpty()) return Optional.empty();
        return Optional.of(endpoints.get(random.nextInt(endpoints.size())));
    }

    public boolean isEmpty() { return endpoints.isEmpty(); }
    public List<InetSocketAddress> endpoints() { return endpoints; }
}
