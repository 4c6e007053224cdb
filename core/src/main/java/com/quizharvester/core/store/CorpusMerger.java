package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.util.StructuredLog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * 두 코퍼스 파일 병합.
 * - 기존(existing): 복구 읽기. 깨진 레코드는 버리고 id 수집, 병합은 계속
 * - 신규(incoming): 엄격 읽기. 하나라도 위반이면 실패
 * - id 충돌은 preferNew로 결정, 순서는 기존 먼저 → 신규 추가분
 * - 결과는 검증 후 원자적으로 기록
 */
public final class CorpusMerger {

    private static final StructuredLog SLOG = StructuredLog.get(CorpusMerger.class);

    private final CorpusIO io;

    public CorpusMerger() {
        this(new CorpusIO());
    }

    public CorpusMerger(CorpusIO io) {
        this.io = Objects.requireNonNull(io, "io");
    }

    /** 결과를 existingPath에 덮어쓴다. */
    public MergeResult mergeCorpora(Path existingPath, Path incomingPath, boolean preferNew) throws IOException {
        return mergeCorpora(existingPath, incomingPath, existingPath, preferNew);
    }

    public MergeResult mergeCorpora(Path existingPath, Path incomingPath, Path outPath, boolean preferNew) throws IOException {
        Objects.requireNonNull(existingPath, "existingPath");
        Objects.requireNonNull(incomingPath, "incomingPath");
        Objects.requireNonNull(outPath, "outPath");

        CorpusIO.Repaired repaired = io.readRepaired(existingPath);
        if (!repaired.droppedIds().isEmpty()) {
            SLOG.warn("merge-dropped",
                    "count", repaired.droppedIds().size(),
                    "ids", String.join(",", repaired.droppedIds()));
        }
        Corpus existing = repaired.corpus();
        Corpus incoming = io.readStrict(incomingPath);

        LinkedHashMap<String, QuestionRecord> merged = new LinkedHashMap<>();
        for (QuestionRecord r : existing.questions()) merged.put(r.id(), r);

        int added = 0;
        int replaced = 0;
        for (QuestionRecord r : incoming.questions()) {
            if (merged.containsKey(r.id())) {
                if (preferNew) {
                    merged.put(r.id(), r);
                    replaced++;
                }
            } else {
                merged.put(r.id(), r);
                added++;
            }
        }

        String generatedAt = firstNonBlank(incoming.generatedAt(), existing.generatedAt());
        List<String> sessions = (incoming.sourceSessions() != null && !incoming.sourceSessions().isEmpty())
                ? incoming.sourceSessions()
                : (existing.sourceSessions() != null ? existing.sourceSessions() : List.of());

        Corpus result = new Corpus(
                Math.max(existing.version(), incoming.version()),
                new ArrayList<>(merged.values()),
                generatedAt,
                sessions);

        io.write(outPath, result);
        SLOG.info("merge-done", "added", added, "replaced", replaced,
                "total", result.size(), "dropped", repaired.droppedIds().size());
        return new MergeResult(added, replaced, result, repaired.droppedIds());
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        return b;
    }
}
