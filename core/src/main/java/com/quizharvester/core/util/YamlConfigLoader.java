package com.quizharvester.core.util;

import com.quizharvester.core.config.HarvestConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

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
import java.util.function.IntConsumer;

/**
 * harvest.yml을 읽어 HarvestConfig로 변환. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * baseUrl: "https://www.ap-siken.com/apkakomon.php"
 * sessions: ["令和6年春期", "令和5年秋期"]   # 또는 "all" / "a,b"
 * output: "data/questions_seed.json"
 * throttleMs: 1000
 * maxRetries: 5
 * retryBaseDelayMs: 1000
 * timeoutMs: 20000
 * maxSteps: 80
 * resume: false
 * preferNew: false
 * debugPages: false
 * debugDir: "debug_pages"
 *
 * cache:
 *   enabled: true
 *   dir: ".cache/http"
 *
 * walker:
 *   stallRetries: 3
 *   stallPauseMs: 1000
 *   idPrefix: "ap-"
 *   markerFormat: "第%d問"
 *   examCount: 40
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "harvest.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 harvest.yml. 없으면 기본값 */
    public static HarvestConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        return Files.exists(p) ? load(p) : HarvestConfig.defaults();
    }

    public static HarvestConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("harvest.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static HarvestConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        HarvestConfig cfg = HarvestConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "baseUrl", cfg::setBaseUrl);
        setStringList(map, "sessions", cfg::setSessions);
        setPath(map, "output", cfg::setOutput);
        setLong(map, "throttleMs", cfg::setThrottleMs);
        setInt(map, "maxRetries", cfg::setMaxRetries);
        setMillis(map, "retryBaseDelayMs", cfg::setRetryBaseDelay);
        setMillis(map, "timeoutMs", cfg::setTimeout);
        setInt(map, "maxSteps", cfg::setMaxSteps);
        setBoolean(map, "resume", cfg::setResume);
        setBoolean(map, "preferNew", cfg::setPreferNew);
        setBoolean(map, "debugPages", cfg::setDebugPages);
        setPath(map, "debugDir", cfg::setDebugDir);

        // 2) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.getCache();
            setBoolean(cache, "enabled", c::setEnabled);
            setPath(cache, "dir", c::setDir);
        }

        // 3) walker.*
        Map<String, Object> walker = getMap(map, "walker");
        if (walker != null) {
            var w = cfg.walker();
            setInt(walker, "stallRetries", w::setStallRetries);
            setMillis(walker, "stallPauseMs", w::setStallPause);
            setString(walker, "idPrefix", w::setIdPrefix);
            setString(walker, "markerFormat", w::setMarkerFormat);
            setInt(walker, "examCount", w::setExamCount);
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

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept((long) parseInt(key, v));
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, v);
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }
}
