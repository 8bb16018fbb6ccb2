package com.rchttp.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * rchttp.yml을 읽어 ClientConfig로 변환.
 *
 * 예상 YAML 키:
 * maxRetries: 10
 * baseRetryDelayMs: 20
 * requestTimeoutMs: 10000
 * noRetryPaths: ["/healthcheck", "/publish"]   # 또는 "/a,/b"
 * transport:
 *   connectTimeoutMs: 5000
 *   followRedirects: true
 */
public final class ClientConfigLoader {

    public static final String DEFAULT_FILE = "rchttp.yml";

    private ClientConfigLoader() {}

    public static ClientConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ClientConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스 등 스트림에서 직접 읽기 */
    public static ClientConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ClientConfig.Builder b = ClientConfig.builder();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return b.build();
        }

        setInt(map, "maxRetries", b::maxRetries);
        setLong(map, "baseRetryDelayMs", b::baseRetryDelayMs);
        setLong(map, "requestTimeoutMs", b::requestTimeoutMs);
        setStringList(map, "noRetryPaths", b::noRetryPaths);

        Map<String, Object> transport = getMap(map, "transport");
        if (transport != null) {
            setLong(transport, "connectTimeoutMs", b::connectTimeoutMs);
            setBoolean(transport, "followRedirects", b::followRedirects);
        }

        // 범위 검증은 build()에서
        return b.build();
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
            // "/a,/b" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) {
                if (!p.isBlank()) out.add(p.trim());
            }
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
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
