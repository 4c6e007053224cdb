package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.quizharvester.core.store.Records.rec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionStoreTest {

    @TempDir Path tmp;

    private static List<String> ids(QuestionStore store) {
        return store.allRecords().stream().map(QuestionRecord::id).toList();
    }

    @Test
    @DisplayName("같은 레코드 두 번 add → 두 번째는 무시")
    void add_isIdempotent() {
        QuestionStore store = new QuestionStore();
        QuestionRecord r = rec("ap-2024-q001", "DNSの役割は?");

        assertThat(store.add(r)).isTrue();
        List<QuestionRecord> before = store.allRecords();
        assertThat(store.add(r)).isFalse();

        assertThat(store.allRecords()).isEqualTo(before).hasSize(1);
        assertThat(store.getSkippedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("id가 달라도 본문+선택지가 같으면 1건만")
    void contentDuplicate_withDifferentId_isRejected() {
        QuestionStore store = new QuestionStore();

        assertThat(store.add(rec("ap-2024-q001", "DNSの役割は?"))).isTrue();
        assertThat(store.add(rec("ap-2024-q017", "  DNSの役割は? "))).isFalse();
        // 전각/반각, 대소문자 차이는 같은 내용으로 본다
        assertThat(store.add(rec("x", "ＴＣＰとは", 0, "A", "B"))).isTrue();
        assertThat(store.add(rec("y", "tcpとは", 0, "a", "b"))).isFalse();

        assertThat(ids(store)).containsExactly("ap-2024-q001", "x");
    }

    @Test
    void recordsWithoutText_areNotContentDeduped() {
        QuestionStore store = new QuestionStore();

        assertThat(store.add(rec("a", null, 0, "ア", "イ"))).isTrue();
        assertThat(store.add(rec("b", "", 0, "ア", "イ"))).isTrue();

        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void sameId_skippedByDefault_replacedWhenPreferNew() {
        QuestionStore keep = new QuestionStore(false);
        keep.add(rec("q", "old text", 1, "a", "b"));
        assertThat(keep.add(rec("q", "new text", 0, "a", "b"))).isFalse();
        assertThat(keep.allRecords().get(0).answerIndex()).isEqualTo(1);

        QuestionStore prefer = new QuestionStore(true);
        prefer.add(rec("q", "old text", 1, "a", "b"));
        assertThat(prefer.add(rec("q", "new text", 0, "a", "b"))).isTrue();
        assertThat(prefer.allRecords()).singleElement()
                .satisfies(r -> assertThat(r.text()).isEqualTo("new text"));
        assertThat(prefer.getReplacedCount()).isEqualTo(1);

        // 교체 후 옛 내용 지문은 풀려 다른 id로 다시 들어올 수 있다
        assertThat(prefer.add(rec("q2", "old text", 1, "a", "b"))).isTrue();
    }

    @Test
    void preferNew_stillRejectsContentOwnedByAnotherId() {
        QuestionStore store = new QuestionStore(true);
        store.add(rec("a", "same"));
        store.add(rec("b", "other"));

        assertThat(store.add(rec("b", "same"))).isFalse();
        assertThat(store.allRecords().get(1).text()).isEqualTo("other");
    }

    @Test
    void invalidRecord_isRejected_withoutMutation() {
        QuestionStore store = new QuestionStore();

        assertThat(store.add(rec("bad", "t", 4, "a", "b"))).isFalse();
        assertThat(store.add(rec(null, "t"))).isFalse();

        assertThat(store.size()).isZero();
        assertThat(store.getRejectedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("출력 순서: 불러온 레코드(원래 순서) → 새 레코드(삽입 순서)")
    void order_isExistingFirstThenInsertion() {
        QuestionStore store = new QuestionStore(true);
        store.loadExisting(Corpus.of(List.of(rec("z", "zz"), rec("a", "aa"))));

        store.add(rec("m", "mm"));
        store.add(rec("b", "bb"));
        store.add(rec("z", "zz v2"));   // 교체는 자리 유지

        assertThat(ids(store)).containsExactly("z", "a", "m", "b");
        assertThat(store.allRecords().get(0).text()).isEqualTo("zz v2");
    }

    @Test
    void loadExisting_doesNotDedupLoadedRecords_butGuardsLaterAdds() {
        QuestionStore store = new QuestionStore();
        store.loadExisting(Corpus.of(List.of(rec("a", "same"), rec("b", "same"))));

        assertThat(ids(store)).containsExactly("a", "b");
        assertThat(store.add(rec("c", "same"))).isFalse();
        assertThat(store.contains("b")).isTrue();
    }

    @Test
    void nextSequence_isPerPartition_startingAtOne() {
        QuestionStore store = new QuestionStore();

        assertThat(store.nextSequence(2024)).isEqualTo(1);
        assertThat(store.nextSequence(2024)).isEqualTo(2);
        assertThat(store.nextSequence(2023)).isEqualTo(1);
        assertThat(store.nextSequence(2024)).isEqualTo(3);

        assertThat(new QuestionStore().nextSequence(2024)).isEqualTo(1);   // 인스턴스별 독립
    }

    @Test
    void toCorpus_appendsNewSessionLabels_andOverridesTimestamp() {
        QuestionStore store = new QuestionStore();
        store.loadExisting(new Corpus(1, List.of(rec("a", "aa")), "2023-01-01T00:00:00Z", List.of("令和5年秋期")));

        Corpus c = store.toCorpus("2024-06-01T00:00:00Z", List.of("令和6年春期", "令和5年秋期"));

        assertThat(c.generatedAt()).isEqualTo("2024-06-01T00:00:00Z");
        assertThat(c.sourceSessions()).containsExactly("令和5年秋期", "令和6年春期");
        assertThat(store.toCorpus().generatedAt()).isEqualTo("2023-01-01T00:00:00Z");
    }

    @Test
    void persist_refusesInvalidCorpus() {
        QuestionStore store = new QuestionStore();
        Path out = tmp.resolve("seed.json");
        Corpus bad = Corpus.of(List.of(rec("a", "t", 7, "x")));

        assertThatThrownBy(() -> store.persist(out, bad)).isInstanceOf(ValidationException.class);
        assertThat(out).doesNotExist();
    }

    @Test
    void save_writesCurrentWorkingSet() throws Exception {
        QuestionStore store = new QuestionStore();
        store.add(rec("a", "aa"));
        Path out = tmp.resolve("nested/dir/seed.json");

        store.save(out);

        assertThat(new CorpusIO().readStrict(out).questions()).extracting(QuestionRecord::id).containsExactly("a");
    }

    @Test
    void stats_countsPerPartitionAndCategory() {
        QuestionStore store = new QuestionStore();
        store.add(rec("a", "aa"));
        store.add(rec("b", "bb").toBuilder().partitionKey(2023).category("").build());

        CorpusSummary s = store.stats();

        assertThat(s.total()).isEqualTo(2);
        assertThat(s.perPartition()).containsEntry(2023, 1).containsEntry(2024, 1);
        assertThat(s.perCategory()).containsEntry("network", 1).containsEntry("unknown", 1);
    }
}
