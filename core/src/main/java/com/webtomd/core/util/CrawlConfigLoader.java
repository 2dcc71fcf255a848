package com.webtomd.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.SelectorType;
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

/**
 * 크롤 설정 파일(JSON 또는 YAML)을 CrawlConfig.Builder에 반영.
 * 확장자 .yml/.yaml 이면 YAML, 그 외는 JSON으로 읽는다.
 *
 * 예상 키:
 * {
 *   "type": "class",                 // 필수: class | id | tag
 *   "value": "urlList",              // 필수
 *   "url": "https://example.com/tutorial",
 *   "filename": "tutorial.md",
 *   "pre_remove_type": "class",
 *   "pre_remove_value": "ads|banner",
 *   "output_dir": "downloads",
 *   "delay": 1.0,                    // 초
 *   "timeout_ms": 30000
 * }
 * camelCase 표기(preRemoveType, outputDir, timeoutMs ...)도 받는다.
 */
public final class CrawlConfigLoader {

    private CrawlConfigLoader() {}

    private static final ObjectMapper OM = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** 새 빌더에 파일 내용을 반영해 돌려준다. */
    public static CrawlConfig.Builder load(Path file) throws IOException {
        return applyTo(file, CrawlConfig.builder());
    }

    /**
     * 파일에 있는 키만 builder에 덮어쓴다(없는 키는 builder 값 유지).
     * type/value 누락, 지원하지 않는 type이면 IllegalArgumentException.
     */
    public static CrawlConfig.Builder applyTo(Path file, CrawlConfig.Builder builder) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(builder, "builder");
        if (!Files.exists(file)) {
            throw new IOException("config file not found at: " + file.toAbsolutePath());
        }
        Map<?, ?> map = isYaml(file) ? readYaml(file) : readJson(file);
        applyMap(map, builder);
        return builder;
    }

    /** 이미 읽은 맵(JSON 요청 본문 등)을 반영. 규칙은 파일과 같다. */
    public static CrawlConfig.Builder applyMap(Map<?, ?> map, CrawlConfig.Builder b) {
        applySelectors(map, b);

        setString(map, b::baseUrl, "url");
        setString(map, b::outputFilename, "filename");
        setString(map, s -> b.outputRoot(Path.of(s)), "output_dir", "outputDir");

        Object delay = map.get("delay");
        if (delay != null) {
            double sec = (delay instanceof Number n) ? n.doubleValue() : Double.parseDouble(String.valueOf(delay));
            b.requestDelay(Duration.ofMillis(Math.round(sec * 1000)));
        }
        Object timeout = first(map, "timeout_ms", "timeoutMs");
        if (timeout != null) {
            long ms = (timeout instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(timeout));
            if (ms > 0) b.timeout(Duration.ofMillis(ms));
        }
        return b;
    }

    /**
     * type/value 와 사전 제거 키만 반영(원격 요청용).
     * 출력 위치, 지연, 타임아웃 같은 키는 읽지 않는다.
     */
    public static CrawlConfig.Builder applySelectors(Map<?, ?> map, CrawlConfig.Builder b) {
        Objects.requireNonNull(map, "map");
        for (String required : List.of("type", "value")) {
            if (map.get(required) == null) {
                throw new IllegalArgumentException("config is missing required field: " + required);
            }
        }
        b.selector(SelectorType.parse(String.valueOf(map.get("type"))), String.valueOf(map.get("value")));

        Object preType = first(map, "pre_remove_type", "preRemoveType");
        Object preValue = first(map, "pre_remove_value", "preRemoveValue");
        if (preType != null || preValue != null) {
            b.preRemove(preType == null ? null : String.valueOf(preType),
                    preValue == null ? null : String.valueOf(preValue));
        }
        return b;
    }

    // ------------ helpers ------------
    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static Map<?, ?> readJson(Path file) throws IOException {
        Object root = OM.readValue(file.toFile(), Object.class);
        if (root instanceof Map<?, ?> m) return m;
        throw new IllegalArgumentException("config root must be a JSON object: " + file);
    }

    private static Map<?, ?> readYaml(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);
            if (root instanceof Map<?, ?> m) return m;
            throw new IllegalArgumentException("config root must be a YAML mapping: " + file);
        }
    }

    private static Object first(Map<?, ?> map, String... keys) {
        for (String k : keys) {
            Object v = map.get(k);
            if (v != null) return v;
        }
        return null;
    }

    private static void setString(Map<?, ?> map, Consumer<String> setter, String... keys) {
        Object v = first(map, keys);
        if (v != null && !String.valueOf(v).isBlank()) setter.accept(String.valueOf(v).trim());
    }
}
