package com.quizharvester.core.walker;

/**
 * 스텝 1건의 최종 결과.
 *
 * @param stepIndex 0-base qno
 * @param status    ADVANCED | ABANDONED
 * @param attempts  사용한 시도 수(1..stallRetries)
 * @param offered   추출기가 돌려준 후보 수
 * @param accepted  Store가 받아들인 수
 */
public record StepOutcome(int stepIndex, Status status, int attempts, int offered, int accepted) {

    public enum Status { ADVANCED, ABANDONED }

    public static StepOutcome advanced(int stepIndex, int attempts, int offered, int accepted) {
        return new StepOutcome(stepIndex, Status.ADVANCED, attempts, offered, accepted);
    }

    public static StepOutcome abandoned(int stepIndex, int attempts) {
        return new StepOutcome(stepIndex, Status.ABANDONED, attempts, 0, 0);
    }

    public boolean isAbandoned() {
        return status == Status.ABANDONED;
    }
}
