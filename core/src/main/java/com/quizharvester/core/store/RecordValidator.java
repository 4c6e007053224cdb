package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.QuestionRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 후보 레코드와 저장 레코드 사이의 유일한 관문.
 * - id 비어있지 않음
 * - choices 1개 이상, 각 항목 non-blank
 * - answerIndex는 -1(미상) 또는 choices 범위 내
 */
public final class RecordValidator {
    private RecordValidator() {}

    public static void validate(QuestionRecord r) {
        if (r == null) throw new ValidationException(null, "record is null");
        String id = r.id();
        if (!r.hasId()) {
            throw new ValidationException(null, "id must be non-empty");
        }
        List<String> choices = r.choices();
        if (choices == null || choices.isEmpty()) {
            throw new ValidationException(id, "choices must be a non-empty list");
        }
        for (int i = 0; i < choices.size(); i++) {
            String c = choices.get(i);
            if (c == null || c.isBlank()) {
                throw new ValidationException(id, "choices[" + i + "] is empty or whitespace");
            }
        }
        int ai = r.answerIndex();
        if (ai != QuestionRecord.UNKNOWN_ANSWER && (ai < 0 || ai >= choices.size())) {
            throw new ValidationException(id, "answerIndex " + ai + " out of range for " + choices.size() + " choices");
        }
    }

    /** 코퍼스 전체: 레코드별 검증 + id 유일성 */
    public static void validateCorpus(Corpus corpus) {
        if (corpus == null) throw new ValidationException(null, "corpus is null");
        Set<String> seen = new HashSet<>();
        for (QuestionRecord r : corpus.questions()) {
            validate(r);
            if (!seen.add(r.id())) {
                throw new ValidationException(r.id(), "duplicate id in corpus");
            }
        }
    }

    public static boolean isValid(QuestionRecord r) {
        try {
            validate(r);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }
}
