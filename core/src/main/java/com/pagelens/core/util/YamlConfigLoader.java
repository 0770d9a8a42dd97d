package com.pagelens.core.util;

import com.pagelens.core.model.ExtractorConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * pagelens.yml을 읽어 ExtractorConfig로 변환.
 *
 * 예상 YAML 키:
 * userAgent: "PageLens/0.1 (+extractor)"
 * pageTimeoutMs: 15000
 * followRedirects: true
 * fetchAttempts: 2
 * maxColors: 50
 * phoneDefaultRegion: "US"
 *
 * robots:
 *   fetch: true
 *   timeoutMs: 5000
 *   cacheTtlMinutes: 30
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_RESOURCE = "pagelens.yml";

    private YamlConfigLoader() {}

    /** 클래스패스의 pagelens.yml. 없으면 기본값 */
    public static ExtractorConfig loadDefault() throws IOException {
        try (InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                ExtractorConfig cfg = ExtractorConfig.defaults();
                cfg.validate();
                return cfg;
            }
            return load(in);
        }
    }

    public static ExtractorConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("pagelens.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ExtractorConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ExtractorConfig cfg = ExtractorConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        setString(map, "userAgent", cfg::setUserAgent);
        setLong(map, "pageTimeoutMs", cfg::setPageTimeoutMs);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "fetchAttempts", cfg::setFetchAttempts);
        setInt(map, "maxColors", cfg::setMaxColors);
        setString(map, "phoneDefaultRegion", cfg::setPhoneDefaultRegion);

        Map<String, Object> robots = getMap(map, "robots");
        if (robots != null) {
            var r = cfg.getRobots();
            setBoolean(robots, "fetch", r::setFetch);
            setInt(robots, "timeoutMs", r::setTimeoutMs);
            setInt(robots, "cacheTtlMinutes", r::setCacheTtlMinutes);
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

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
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

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
