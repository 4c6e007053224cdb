package com.quizharvester.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 코퍼스 파일 읽기/쓰기.
 * - readStrict: 구조/불변식 위반 시 즉시 실패(단일 생산자 결과물용)
 * - readRepaired: 위반 레코드를 버리고 id를 모아 돌려준다(구 스키마 허용)
 * - write: 검증 후 같은 디렉터리 임시 파일에 쓰고 rename (부분 기록 노출 없음)
 */
public final class CorpusIO {

    static final String MISSING_ID = "<missing id>";
    static final String INVALID_CORPUS = "<invalid corpus>";

    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** 복구 읽기 결과 */
    public record Repaired(Corpus corpus, List<String> droppedIds) {
        public Repaired {
            droppedIds = List.copyOf(droppedIds);
        }
    }

    public ObjectMapper mapper() {
        return om;
    }

    public Corpus readStrict(Path path) throws IOException {
        JsonNode root = readTree(path);
        if (!(root instanceof ObjectNode) || !root.path("questions").isArray()) {
            throw new CorpusFormatException(path, "corpus must be an object with a 'questions' array", null);
        }
        Corpus corpus;
        try {
            corpus = om.treeToValue(root, Corpus.class);
        } catch (JsonProcessingException e) {
            throw new CorpusFormatException(path, "malformed corpus (" + e.getOriginalMessage() + ")", e);
        }
        RecordValidator.validateCorpus(corpus);
        return corpus;
    }

    /** 파일이 없으면 빈 코퍼스. JSON 자체가 깨졌으면 CorpusFormatException. */
    public Repaired readRepaired(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new Repaired(Corpus.empty(), List.of());
        }
        JsonNode root = readTree(path);
        if (!(root instanceof ObjectNode)) {
            return new Repaired(Corpus.empty(), List.of(INVALID_CORPUS));
        }
        List<QuestionRecord> valid = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        JsonNode questions = root.path("questions");
        if (questions.isArray()) {
            for (JsonNode q : questions) {
                String rawId = q.path("id").isTextual() && !q.path("id").asText().isBlank()
                        ? q.path("id").asText() : MISSING_ID;
                QuestionRecord r;
                try {
                    r = om.treeToValue(q, QuestionRecord.class);
                    RecordValidator.validate(r);
                } catch (JsonProcessingException | ValidationException e) {
                    dropped.add(rawId);
                    continue;
                }
                if (!seen.add(r.id())) {
                    dropped.add(r.id());
                    continue;
                }
                valid.add(r);
            }
        }

        JsonNode v = root.path("version");
        int version = v.isInt() ? v.asInt() : Corpus.CURRENT_VERSION;
        JsonNode g = root.path("generatedAt");
        String generatedAt = g.isTextual() ? g.asText() : null;
        List<String> sessions = textList(root.path("sourceSessions"));
        return new Repaired(new Corpus(version, valid, generatedAt, sessions), dropped);
    }

    public void write(Path path, Corpus corpus) throws IOException {
        Objects.requireNonNull(path, "path");
        RecordValidator.validateCorpus(corpus);

        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        try {
            Files.write(tmp, om.writeValueAsBytes(corpus));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private JsonNode readTree(Path path) throws IOException {
        try {
            return om.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new CorpusFormatException(path, "not valid JSON (" + e.getOriginalMessage() + ")", e);
        }
    }

    private static List<String> textList(JsonNode n) {
        if (!n.isArray()) return null;
        List<String> out = new ArrayList<>();
        for (JsonNode e : n) {
            if (!e.isTextual()) return null;
            out.add(e.asText());
        }
        return out;
    }
}
