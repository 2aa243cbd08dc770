package com.webgraph.core.util;

import com.webgraph.core.model.CrawlerConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * 루트 crawler.yml을 읽어 CrawlerConfig로 변환.
 *
 * 예상 YAML 키:
 * seeds: ["https://example.com/"]
 * allowedDomains: ["example.com"]
 * canonicalizeUrls: false
 * concurrency: 1
 * scope:
 *   maxDepth: 1
 *   maxResults: 100        # 생략 시 무제한
 *   restrictToSeedDomain: true
 * fetch:
 *   timeoutMs: 10000
 *   followRedirects: true
 *   userAgent: "WebGraphCrawler/0.1 (+crawler)"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlerConfig loadDefault() throws IOException {
        return load(Path.of("crawler.yml"));
    }

    public static CrawlerConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawler.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    public static CrawlerConfig fromStream(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlerConfig cfg = CrawlerConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setStringList(map, "seeds", cfg::setSeeds);
        setStringList(map, "allowedDomains", cfg::setAllowedDomains);
        setBoolean(map, "canonicalizeUrls", cfg::setCanonicalizeUrls);
        setInt(map, "concurrency", cfg::setConcurrency);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "maxResults", cfg::setMaxResults);
            setBoolean(scope, "restrictToSeedDomain", cfg::setRestrictToSeedDomain);
        }

        // 3) fetch.*
        Map<String, Object> fetch = getMap(map, "fetch");
        if (fetch != null) {
            Object ms = fetch.get("timeoutMs");
            if (ms != null) cfg.setTimeoutMs(ms instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(ms).trim()));
            setBoolean(fetch, "followRedirects", cfg::setFollowRedirects);
            Object ua = fetch.get("userAgent");
            if (ua != null) cfg.setUserAgent(String.valueOf(ua));
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }
}
