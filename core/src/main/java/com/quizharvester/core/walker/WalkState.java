package com.quizharvester.core.walker;

/** 세션 1회 순회 상태: STARTING → STEPPING → {ADVANCING, STALLED} → STEPPING | DONE */
public enum WalkState {
    STARTING,
    STEPPING,
    ADVANCING,
    STALLED,
    DONE
}
