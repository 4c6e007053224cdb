package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.util.StructuredLog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 한 번의 실행 동안 레코드 작업 집합을 보관하는 저장소.
 * <ul>
 *   <li>중복 판정 2중: 같은 id(preferNew가 아니면 skip), 다른 id인데 같은 내용 지문(reject)</li>
 *   <li>출력 순서: 불러온 기존 레코드(원래 순서) → 새로 추가된 레코드(삽입 순서)</li>
 *   <li>파티션별 시퀀스 카운터는 인스턴스 소유(전역 상태 아님)</li>
 * </ul>
 * 동시 접근을 가정하지 않는다. 세션 병렬화 시 add/nextSequence를 직렬화할 것.
 */
public final class QuestionStore {

    private static final StructuredLog SLOG = StructuredLog.get(QuestionStore.class);

    private final boolean preferNew;
    private final CorpusIO io;

    private final LinkedHashMap<String, QuestionRecord> byId = new LinkedHashMap<>();
    private final Map<String, String> idByContent = new HashMap<>();   // 지문 → 최초 보유 id
    private final Map<Integer, Integer> sequences = new HashMap<>();

    private int version = Corpus.CURRENT_VERSION;
    private String generatedAt;
    private List<String> sourceSessions;

    private int added;
    private int replaced;
    private int skipped;
    private int rejected;

    public QuestionStore() {
        this(false);
    }

    public QuestionStore(boolean preferNew) {
        this(preferNew, new CorpusIO());
    }

    public QuestionStore(boolean preferNew, CorpusIO io) {
        this.preferNew = preferNew;
        this.io = Objects.requireNonNull(io, "io");
    }

    /**
     * @return 반영되었으면 true. 검증 실패/중복이면 false(상태 변화 없음).
     */
    public boolean add(QuestionRecord record) {
        try {
            RecordValidator.validate(record);
        } catch (ValidationException e) {
            rejected++;
            SLOG.warn("record-rejected", "id", e.getRecordId(), "reason", e.getMessage());
            return false;
        }
        String id = record.id();
        String fp = ContentFingerprint.of(record);

        if (byId.containsKey(id)) {
            if (!preferNew) {
                skipped++;
                SLOG.debug("record-duplicate-id", "id", id);
                return false;
            }
            String owner = (fp == null) ? null : idByContent.get(fp);
            if (owner != null && !owner.equals(id)) {
                skipped++;
                SLOG.debug("record-duplicate-content", "id", id, "sameAs", owner);
                return false;
            }
            QuestionRecord old = byId.put(id, record);
            unindex(old);
            index(id, fp);
            replaced++;
            return true;
        }

        if (fp != null && idByContent.containsKey(fp)) {
            skipped++;
            SLOG.debug("record-duplicate-content", "id", id, "sameAs", idByContent.get(fp));
            return false;
        }
        byId.put(id, record);
        index(id, fp);
        added++;
        return true;
    }

    /** 여러 건 추가, 반영된 건수 반환 */
    public int addAll(List<QuestionRecord> records) {
        int n = 0;
        for (QuestionRecord r : records) {
            if (add(r)) n++;
        }
        return n;
    }

    /**
     * 기존 코퍼스로 작업 집합을 초기화한다. 원래 순서를 유지하며,
     * 불러온 레코드끼리는 내용 중복을 소급 적용하지 않는다.
     * 불러온 레코드의 지문은 이후 add의 비교 대상이 된다.
     */
    public void loadExisting(Corpus corpus) {
        Objects.requireNonNull(corpus, "corpus");
        byId.clear();
        idByContent.clear();
        for (QuestionRecord r : corpus.questions()) {
            if (!r.hasId()) continue;
            byId.putIfAbsent(r.id(), r);
            String fp = ContentFingerprint.of(r);
            if (fp != null) idByContent.putIfAbsent(fp, r.id());
        }
        this.version = corpus.version();
        this.generatedAt = corpus.generatedAt();
        this.sourceSessions = corpus.sourceSessions();
    }

    public List<QuestionRecord> allRecords() {
        return List.copyOf(byId.values());
    }

    public int size() {
        return byId.size();
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /** 1부터 시작, 파티션별 독립 증가 */
    public int nextSequence(int partitionKey) {
        return sequences.merge(partitionKey, 1, Integer::sum);
    }

    public void validate(QuestionRecord record) {
        RecordValidator.validate(record);
    }

    /** 현재 작업 집합 스냅샷. generatedAt/sourceSessions는 null이면 불러온 값 유지 */
    public Corpus toCorpus(String generatedAtOverride, List<String> sessionsOverride) {
        List<String> sessions = (sessionsOverride != null) ? mergeSessions(sourceSessions, sessionsOverride) : sourceSessions;
        String gen = (generatedAtOverride != null) ? generatedAtOverride : generatedAt;
        return new Corpus(version, allRecords(), gen, sessions);
    }

    public Corpus toCorpus() {
        return toCorpus(null, null);
    }

    /** 검증 후 원자적 저장. 검증 실패는 ValidationException으로 그대로 전파(부분 기록 없음). */
    public void persist(Path path, Corpus corpus) throws IOException {
        io.write(path, corpus);
    }

    public void save(Path path) throws IOException {
        persist(path, toCorpus());
    }

    public CorpusSummary stats() {
        return CorpusSummary.of(allRecords());
    }

    public int getAddedCount() { return added; }
    public int getReplacedCount() { return replaced; }
    public int getSkippedCount() { return skipped; }
    public int getRejectedCount() { return rejected; }
    public boolean isPreferNew() { return preferNew; }

    private void index(String id, String fp) {
        if (fp != null) idByContent.putIfAbsent(fp, id);
    }

    private void unindex(QuestionRecord old) {
        if (old == null) return;
        String fp = ContentFingerprint.of(old);
        if (fp != null && old.id().equals(idByContent.get(fp))) idByContent.remove(fp);
    }

    private static List<String> mergeSessions(List<String> existing, List<String> incoming) {
        List<String> out = new ArrayList<>();
        if (existing != null) out.addAll(existing);
        for (String s : incoming) {
            if (!out.contains(s)) out.add(s);
        }
        return out;
    }
}
