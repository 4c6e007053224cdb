package com.quizharvester.core.walker;

import com.quizharvester.core.model.SessionMeta;

import java.util.List;
import java.util.OptionalInt;

/** 세션 1회 순회 결과(스텝별 상태 + 총 문항 수 힌트). */
public record WalkReport(SessionMeta session, List<StepOutcome> steps, Integer totalHint) {

    public WalkReport {
        steps = List.copyOf(steps);
    }

    public int acceptedRecords() {
        return steps.stream().mapToInt(StepOutcome::accepted).sum();
    }

    public List<Integer> abandonedSteps() {
        return steps.stream().filter(StepOutcome::isAbandoned).map(StepOutcome::stepIndex).toList();
    }

    public long advancedCount() {
        return steps.stream().filter(s -> !s.isAbandoned()).count();
    }

    public OptionalInt totalQuestionHint() {
        return totalHint == null ? OptionalInt.empty() : OptionalInt.of(totalHint);
    }
}
