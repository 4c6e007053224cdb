package com.quizharvester.core.util;

/** 수집 진행 알림. 세션 단위로만 호출된다. */
@FunctionalInterface
public interface ProgressListener {

    enum Phase { RESUME, WALK, PERSIST }

    /**
     * @param done   처리한 단위 수
     * @param total  전체 단위 수(모르면 -1)
     * @param detail 현재 대상(세션 라벨, 출력 경로 등). 없으면 ""
     */
    void onProgress(Phase phase, int done, int total, String detail);

    ProgressListener NONE = (phase, done, total, detail) -> {};
}
