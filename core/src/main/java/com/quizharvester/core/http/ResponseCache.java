package com.quizharvester.core.http;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * 디스크 응답 캐시: 지문 1개 = 파일 1개(&lt;key&gt;.cache), 원본 바이트 그대로.
 * 한 번 쓰면 덮어쓰지 않고 자동 만료도 없다. 디렉터리째 지우면 재수집.
 */
public final class ResponseCache {
    private static final String SUFFIX = ".cache";

    private final Path dir;

    public ResponseCache(Path dir) throws IOException {
        this.dir = Objects.requireNonNull(dir, "dir");
        Files.createDirectories(dir);
    }

    public Path dir() { return dir; }

    public Optional<byte[]> get(String key) throws IOException {
        Path p = pathFor(key);
        if (!Files.isRegularFile(p)) return Optional.empty();
        return Optional.of(Files.readAllBytes(p));
    }

    /** 이미 있으면 false(쓰기 생략). 쓰기 실패는 그대로 전파. */
    public boolean putIfAbsent(String key, byte[] body) throws IOException {
        Path p = pathFor(key);
        if (Files.isRegularFile(p)) return false;
        if (Files.exists(p)) throw new IOException("Cache entry is not a regular file: " + p);
        Files.write(p, body == null ? new byte[0] : body);
        return true;
    }

    Path pathFor(String key) {
        Objects.requireNonNull(key, "key");
        // 파일명으로 못 쓰는 문자만 치환(명시 키 "sid-qno" 등은 그대로 유지)
        String safe = key.replaceAll("[\\\\/:*?\"<>|\\s]", "_");
        return dir.resolve(safe + SUFFIX);
    }
}
