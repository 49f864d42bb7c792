package com.seccrawl.core.util;

import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 * CLI 플래그를 덮어쓸 수 있도록 여기서는 validate()를 호출하지 않는다.
 *
 * 예상 YAML 키:
 * startUrl: "https://example.com"
 * delay: 1.0              # 초
 * maxRetries: 3
 * timeout: 10             # 초
 * maxPages: 100
 * workers: 1
 * deadlineSeconds: 0
 * followRedirects: true
 * proxy:
 *   enabled: false
 *   list: ["127.0.0.1:8080"]
 * scope:
 *   allowedDomains: ["example.com"]
 *   excludePatterns: ["\\.pdf$"]
 * pagination:
 *   dataSelector: ".comment"     # 별칭: pageSelector
 *   nextSelector: "a.next"
 *   pageParam: "page"
 * output:
 *   dir: "out"
 *   format: json | csv
 *
 * 평면 키(useProxy, proxyList, allowedDomains, excludePatterns, dataSelector,
 * pageSelector, nextSelector, pageParam, outputFormat, outputDir)도 허용.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    public static CrawlConfig fromStream(InputStream in) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("malformed YAML: " + e.getMessage(), e);
        }
        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "startUrl", cfg::setStartUrl);
        setDouble(map, "delay", cfg::setDelaySeconds);
        setInt(map, "maxRetries", cfg::setMaxRetries);
        setDouble(map, "timeout", cfg::setTimeoutSeconds);
        setInt(map, "maxPages", cfg::setMaxPages);
        setInt(map, "workers", cfg::setWorkers);
        setInt(map, "deadlineSeconds", s -> cfg.setDeadline(Duration.ofSeconds(s)));
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setBoolean(map, "useProxy", cfg::setUseProxy);
        setStringList(map, "proxyList", cfg::setProxyList);
        setStringList(map, "allowedDomains", cfg::setAllowedDomains);
        setStringList(map, "excludePatterns", cfg::setExcludePatterns);
        setString(map, "pageSelector", cfg::setDataSelector);
        setString(map, "dataSelector", cfg::setDataSelector);
        setString(map, "nextSelector", cfg::setNextSelector);
        setString(map, "pageParam", cfg::setPageParam);
        setString(map, "outputFormat", cfg::setOutputFormat);
        setString(map, "outputDir", s -> cfg.setOutputDir(Path.of(s)));

        // 2) proxy.*
        Map<String, Object> proxy = getMap(map, "proxy");
        if (proxy != null) {
            setBoolean(proxy, "enabled", cfg::setUseProxy);
            setStringList(proxy, "list", cfg::setProxyList);
        }

        // 3) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setStringList(scope, "allowedDomains", cfg::setAllowedDomains);
            setStringList(scope, "excludePatterns", cfg::setExcludePatterns);
        }

        // 4) pagination.*
        Map<String, Object> pg = getMap(map, "pagination");
        if (pg != null) {
            setString(pg, "pageSelector", cfg::setDataSelector);
            setString(pg, "dataSelector", cfg::setDataSelector);
            setString(pg, "nextSelector", cfg::setNextSelector);
            setString(pg, "pageParam", cfg::setPageParam);
        }

        // 5) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setString(output, "format", cfg::setOutputFormat);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    /**
     * 리스트 또는 "a,b,c" 문자열. 명시적인 빈 리스트 [] 는 그대로 전달(제외 규칙 비활성화 용도).
     * 값 없는 키("excludePatterns:")는 키가 없는 것과 같다.
     */
    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be an integer: " + v, e);
            }
        }
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) {
            try {
                setter.accept(Double.parseDouble(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be a number: " + v, e);
            }
        }
    }
}
