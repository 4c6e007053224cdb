package com.quizharvester.core.service;

import com.quizharvester.core.model.FetchStats;
import com.quizharvester.core.store.CorpusSummary;
import com.quizharvester.core.walker.WalkReport;

import java.nio.file.Path;
import java.util.List;

/**
 * 수집 1회 결과.
 *
 * @param output       기록한 코퍼스 경로
 * @param reports      세션별 순회 결과(실행 순서)
 * @param resumedCount 이어받은 기존 레코드 수
 * @param droppedIds   이어받기 중 복구 과정에서 버린 id
 * @param added        이번 실행에서 새로 들어간 수
 * @param replaced     preferNew로 교체된 수
 * @param corpus       기록된 코퍼스 요약
 * @param fetchStats   페처 통계(모르면 null)
 */
public record HarvestSummary(Path output,
                             List<WalkReport> reports,
                             int resumedCount,
                             List<String> droppedIds,
                             int added,
                             int replaced,
                             CorpusSummary corpus,
                             FetchStats.Snapshot fetchStats) {

    public HarvestSummary {
        reports = List.copyOf(reports);
        droppedIds = List.copyOf(droppedIds);
    }

    public int abandonedSteps() {
        return reports.stream().mapToInt(r -> r.abandonedSteps().size()).sum();
    }
}
