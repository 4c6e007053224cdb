package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.quizharvester.core.store.Records.rec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusMergerTest {

    @TempDir Path tmp;
    private final CorpusIO io = new CorpusIO();
    private final CorpusMerger merger = new CorpusMerger(io);

    private Path write(String name, Corpus c) throws Exception {
        Path p = tmp.resolve(name);
        io.write(p, c);
        return p;
    }

    @Test
    @DisplayName("merge(A, A, false) → 추가 0, 교체 0, 결과는 A")
    void mergeWithItself_isIdentity() throws Exception {
        Corpus a = new Corpus(1, List.of(rec("q1", "t1"), rec("q2", "t2")), "2024-01-01T00:00:00Z", List.of("s"));
        Path existing = write("seed.json", a);
        Path incoming = write("incoming.json", a);

        MergeResult r = merger.mergeCorpora(existing, incoming, false);

        assertThat(r.addedCount()).isZero();
        assertThat(r.replacedCount()).isZero();
        assertThat(r.droppedIds()).isEmpty();
        assertThat(r.merged().questions()).containsExactlyInAnyOrderElementsOf(a.questions());
        assertThat(io.readStrict(existing)).isEqualTo(r.merged());
    }

    @Test
    void preferNew_controlsCollisionResolution() throws Exception {
        Path existing = write("seed.json", Corpus.of(List.of(rec("x", "t", 1, "a", "b", "c"))));
        Path incoming = write("incoming.json", Corpus.of(List.of(rec("x", "t", 2, "a", "b", "c"))));

        MergeResult keep = merger.mergeCorpora(existing, incoming, tmp.resolve("keep.json"), false);
        MergeResult prefer = merger.mergeCorpora(existing, incoming, tmp.resolve("prefer.json"), true);

        assertThat(keep.merged().questions().get(0).answerIndex()).isEqualTo(1);
        assertThat(keep.replacedCount()).isZero();
        assertThat(prefer.merged().questions().get(0).answerIndex()).isEqualTo(2);
        assertThat(prefer.replacedCount()).isEqualTo(1);
    }

    @Test
    void order_isExistingThenNewIds() throws Exception {
        Path existing = write("seed.json", Corpus.of(List.of(rec("b", "bb"), rec("a", "aa"))));
        Path incoming = write("incoming.json", Corpus.of(List.of(rec("c", "cc"), rec("a", "aa2"), rec("0", "00"))));

        MergeResult r = merger.mergeCorpora(existing, incoming, true);

        assertThat(r.merged().questions()).extracting(QuestionRecord::id).containsExactly("b", "a", "c", "0");
        assertThat(r.addedCount()).isEqualTo(2);
        assertThat(r.replacedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("기존 코퍼스의 깨진 레코드는 버리고 병합은 계속")
    void invalidExistingRecords_areDropped_andReported() throws Exception {
        Path existing = tmp.resolve("seed.json");
        Files.writeString(existing, """
                {"version": 1, "questions": [
                  {"id": "keep", "partitionKey": 2024, "choices": ["a"], "answerIndex": 0},
                  {"id": "broken", "partitionKey": 2024, "choices": [], "answerIndex": 0}
                ]}
                """);
        Path incoming = write("incoming.json", Corpus.of(List.of(rec("new", "n"))));

        MergeResult r = merger.mergeCorpora(existing, incoming, false);

        assertThat(r.droppedIds()).containsExactly("broken");
        assertThat(r.merged().questions()).extracting(QuestionRecord::id).containsExactly("keep", "new");
        assertThat(io.readStrict(existing).size()).isEqualTo(2);
    }

    @Test
    void invalidIncoming_isFatal_andNothingIsWritten() throws Exception {
        Corpus a = Corpus.of(List.of(rec("q1", "t1")));
        Path existing = write("seed.json", a);
        Path incoming = tmp.resolve("incoming.json");
        Files.writeString(incoming, "{\"questions\": [{\"id\": \"z\", \"partitionKey\": 2024, \"choices\": [\" \"], \"answerIndex\": 0}]}");
        String before = Files.readString(existing);

        assertThatThrownBy(() -> merger.mergeCorpora(existing, incoming, true))
                .isInstanceOf(ValidationException.class);
        assertThat(Files.readString(existing)).isEqualTo(before);

        Files.writeString(incoming, "[]");
        assertThatThrownBy(() -> merger.mergeCorpora(existing, incoming, true))
                .isInstanceOf(CorpusFormatException.class);
    }

    @Test
    void metadata_prefersIncoming_fallsBackToExisting() throws Exception {
        Path existing = write("seed.json",
                new Corpus(1, List.of(rec("a", "aa")), "2023-01-01T00:00:00Z", List.of("old")));
        Path incoming = write("incoming.json", new Corpus(2, List.of(rec("b", "bb")), null, null));

        Corpus merged = merger.mergeCorpora(existing, incoming, false).merged();

        assertThat(merged.version()).isEqualTo(2);
        assertThat(merged.generatedAt()).isEqualTo("2023-01-01T00:00:00Z");
        assertThat(merged.sourceSessions()).containsExactly("old");
    }

    @Test
    void missingExisting_isTreatedAsEmpty() throws Exception {
        Path incoming = write("incoming.json", Corpus.of(List.of(rec("a", "aa"), rec("b", "bb"))));
        Path existing = tmp.resolve("fresh/seed.json");

        MergeResult r = merger.mergeCorpora(existing, incoming, false);

        assertThat(r.addedCount()).isEqualTo(2);
        assertThat(r.merged().sourceSessions()).isEmpty();
        assertThat(existing).exists();
    }
}
