package com.linkscout.core.util;

import com.linkscout.core.model.AuditConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * linkscout.yml 을 읽어 AuditConfig 로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 10000
 * followRedirects: true
 * userAgent: "LinkScout/0.1 (+crawler)"
 * crawl:
 *   target: "https://example.com"
 *   maxDepth: 1
 * scan:
 *   seedConcurrency: 10
 *   linkConcurrency: 20
 *   errorStatuses: [404, 410]
 *   reportCheckFailures: false
 * extractor:
 *   attributes: ["href", "src", "action"]
 * output:
 *   dir: "out"
 *
 * target / maxDepth 는 최상위 평면 키로 써도 된다(crawl: 섹션이 우선).
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "linkscout.yml";

    private YamlConfigLoader() {}

    /** 파일이 있으면 읽고, 없으면 기본값 */
    public static AuditConfig loadOrDefaults(Path yamlPath) throws IOException {
        if (yamlPath == null || !Files.exists(yamlPath)) {
            AuditConfig cfg = AuditConfig.defaults();
            cfg.validate();
            return cfg;
        }
        return load(yamlPath);
    }

    public static AuditConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("linkscout.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            return fromTree(yaml.load(in));
        }
    }

    /** 이미 파싱된 YAML 트리 → 설정 (테스트에서 문자열 로드 시 사용) */
    public static AuditConfig fromYaml(String text) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        return fromTree(yaml.load(text));
    }

    private static AuditConfig fromTree(Object root) {
        AuditConfig cfg = AuditConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) crawl.*
        Map<String, Object> crawl = getMap(map, "crawl");
        if (crawl != null) {
            setString(crawl, "target", cfg::setTarget);
            setInt(crawl, "maxDepth", cfg::setMaxDepth);
        }

        // 3) scan.*
        Map<String, Object> scan = getMap(map, "scan");
        if (scan != null) {
            var s = cfg.getScan();
            setInt(scan, "seedConcurrency", s::setSeedConcurrency);
            setInt(scan, "linkConcurrency", s::setLinkConcurrency);
            setIntSet(scan, "errorStatuses", s::setErrorStatuses);
            setBoolean(scan, "reportCheckFailures", s::setReportCheckFailures);
        }

        // 4) extractor.attributes
        Map<String, Object> extractor = getMap(map, "extractor");
        if (extractor != null) {
            setStringList(extractor, "attributes", cfg::setUrlAttributes);
        }

        // 5) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
        }

        // 기본값/필수값 확인
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

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static List<String> toStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else if (v != null) {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        out.removeIf(String::isEmpty);
        return out;
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        List<String> out = toStringList(map.get(key));
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setIntSet(Map<?, ?> map, String key, Consumer<Set<Integer>> setter) {
        List<String> raw = toStringList(map.get(key));
        if (raw.isEmpty()) return;
        Set<Integer> out = new LinkedHashSet<>();
        for (String s : raw) {
            try {
                out.add(Integer.parseInt(s));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " contains non-numeric status: " + s, e);
            }
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
