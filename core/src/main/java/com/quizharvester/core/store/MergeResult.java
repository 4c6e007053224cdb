package com.quizharvester.core.store;

import com.quizharvester.core.model.Corpus;

import java.util.List;

/**
 * @param addedCount    기존에 없던 id 수
 * @param replacedCount preferNew로 교체된 id 수
 * @param merged        기록된 병합 코퍼스
 * @param droppedIds    기존 코퍼스 복구 과정에서 버린 레코드 id(없으면 placeholder)
 */
public record MergeResult(int addedCount, int replacedCount, Corpus merged, List<String> droppedIds) {
    public MergeResult {
        droppedIds = List.copyOf(droppedIds);
    }
}
