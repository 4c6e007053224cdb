package com.quizharvester.core.walker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** dir/&lt;label&gt;_qno&lt;n&gt;.&lt;kind&gt; 로 덮어쓰기 저장 */
public final class FileDebugSnapshots implements DebugSnapshots {

    private static final Logger LOG = LoggerFactory.getLogger(FileDebugSnapshots.class);

    private final Path dir;

    public FileDebugSnapshots(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    @Override
    public void save(String sessionLabel, int qno, String kind, String content) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName(sessionLabel, qno, kind));
        Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8);
        LOG.debug("debug snapshot saved: {}", file);
    }

    static String fileName(String sessionLabel, int qno, String kind) {
        String safe = (sessionLabel == null ? "session" : sessionLabel)
                .replaceAll("[\\s/\\\\:*?\"<>|]+", "_");
        return safe + "_qno" + qno + "." + kind;
    }

    public Path getDir() {
        return dir;
    }
}
