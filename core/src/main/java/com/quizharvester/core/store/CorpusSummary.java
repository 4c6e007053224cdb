package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** 총계 + 파티션별/분류별 건수 */
public record CorpusSummary(int total, Map<Integer, Integer> perPartition, Map<String, Integer> perCategory) {

    public CorpusSummary {
        perPartition = Collections.unmodifiableMap(new TreeMap<>(perPartition));
        perCategory = Collections.unmodifiableMap(new TreeMap<>(perCategory));
    }

    public static CorpusSummary of(Corpus corpus) {
        return of(corpus.questions());
    }

    public static CorpusSummary of(List<QuestionRecord> records) {
        Map<Integer, Integer> perPartition = new TreeMap<>();
        Map<String, Integer> perCategory = new TreeMap<>();
        for (QuestionRecord r : records) {
            perPartition.merge(r.partitionKey(), 1, Integer::sum);
            String cat = (r.category() == null || r.category().isBlank()) ? "unknown" : r.category();
            perCategory.merge(cat, 1, Integer::sum);
        }
        return new CorpusSummary(records.size(), perPartition, perCategory);
    }
}
