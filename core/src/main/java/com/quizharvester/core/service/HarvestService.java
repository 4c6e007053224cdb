package com.quizharvester.core.service;

import com.quizharvester.core.api.IFetcher;
import com.quizharvester.core.api.IQuestionExtractor;
import com.quizharvester.core.config.HarvestConfig;
import com.quizharvester.core.extract.JsoupQuestionExtractor;
import com.quizharvester.core.http.HttpFetcher;
import com.quizharvester.core.model.Corpus;
import com.quizharvester.core.model.FetchStats;
import com.quizharvester.core.model.SessionMeta;
import com.quizharvester.core.store.CorpusIO;
import com.quizharvester.core.store.CorpusSummary;
import com.quizharvester.core.store.QuestionStore;
import com.quizharvester.core.util.ProgressListener;
import com.quizharvester.core.util.Sleeper;
import com.quizharvester.core.util.StructuredLog;
import com.quizharvester.core.walker.DebugSnapshots;
import com.quizharvester.core.walker.FileDebugSnapshots;
import com.quizharvester.core.walker.SessionDiscovery;
import com.quizharvester.core.walker.SessionWalker;
import com.quizharvester.core.walker.WalkReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 수집 오케스트레이터:
 *  - (옵션) 기존 코퍼스 이어받기: 복구 읽기 후 Store에 적재
 *  - 회차 발견 → 요청 라벨 해석
 *  - 회차를 하나씩 순서대로 끝까지 순회(단일 워커)
 *  - 검증 후 원자적 저장 + 요약 로그
 * DI 생성자는 테스트/가짜 사이트 주입용.
 */
public final class HarvestService {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestService.class);
    private static final StructuredLog SLOG = StructuredLog.get(HarvestService.class);

    private final HarvestConfig config;
    private final IFetcher fetcher;
    private final IQuestionExtractor extractor;
    private final CorpusIO io;
    private final Sleeper sleeper;
    private final LongSupplier epochSeconds;
    private final Clock clock;

    /** 기본 구현(HttpFetcher + JsoupQuestionExtractor) */
    public HarvestService(HarvestConfig config) throws IOException {
        this(config, new HttpFetcher(config), new JsoupQuestionExtractor(config.walker().getIdPrefix()),
                Sleeper.SYSTEM, () -> System.currentTimeMillis() / 1000L, Clock.systemUTC());
    }

    /** DI/테스트용 */
    public HarvestService(HarvestConfig config, IFetcher fetcher, IQuestionExtractor extractor,
                          Sleeper sleeper, LongSupplier epochSeconds, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.epochSeconds = Objects.requireNonNull(epochSeconds, "epochSeconds");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.io = new CorpusIO();
    }

    /** 사이트가 제공하는 회차 목록(라벨 → 메타) */
    public Map<String, SessionMeta> listSessions() throws IOException, InterruptedException {
        return new SessionDiscovery(fetcher, config.getBaseUrl()).discover();
    }

    public HarvestSummary run() throws IOException, InterruptedException {
        return run(ProgressListener.NONE);
    }

    /**
     * @throws IllegalArgumentException 모르는 회차 라벨
     * @throws com.quizharvester.core.walker.MissingSessionIdException 랜딩 페이지에 sid 없음
     */
    public HarvestSummary run(ProgressListener listener) throws IOException, InterruptedException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Path output = config.getOutput();

        LOG.info("Harvest start: baseUrl={}, sessions={}, output={}, maxSteps={}, cache={}",
                config.getBaseUrl(), config.getSessions(), output, config.getMaxSteps(),
                config.getCache().isEnabled());

        // ---- 0) 이어받기 ----
        QuestionStore store = new QuestionStore(config.isPreferNew(), io);
        int resumed = 0;
        List<String> dropped = List.of();
        if (config.isResume() && Files.exists(output)) {
            pl.onProgress(ProgressListener.Phase.RESUME, 0, -1, output.toString());
            CorpusIO.Repaired repaired = io.readRepaired(output);
            dropped = repaired.droppedIds();
            if (!dropped.isEmpty()) {
                LOG.warn("Resume: dropped {} invalid record(s) from {}: {}", dropped.size(), output, dropped);
                SLOG.warn("merge-dropped", "path", output.toString(), "count", dropped.size(),
                        "ids", String.join(",", dropped));
            }
            store.loadExisting(repaired.corpus());
            resumed = store.size();
            LOG.info("Resuming from existing output: {} ({} record(s))", output, resumed);
        }

        // ---- 1) 회차 해석 ----
        Map<String, SessionMeta> discovered = listSessions();
        List<SessionMeta> sessions = SessionDiscovery.resolve(config.getSessions(), discovered);
        LOG.info("Sessions: discovered={}, selected={}", discovered.size(), sessions.size());

        // ---- 2) 순회 ----
        DebugSnapshots snapshots = config.isDebugPages()
                ? new FileDebugSnapshots(config.getDebugDir())
                : DebugSnapshots.NONE;
        SessionWalker walker = new SessionWalker(fetcher, extractor, store, config, sleeper, epochSeconds, snapshots);

        final int total = sessions.size();
        List<WalkReport> reports = new ArrayList<>(total);
        List<String> labels = new ArrayList<>(total);
        pl.onProgress(ProgressListener.Phase.WALK, 0, total, "");
        for (int i = 0; i < total; i++) {
            SessionMeta s = sessions.get(i);
            reports.add(walker.walk(s, config.getMaxSteps()));
            labels.add(s.label());
            pl.onProgress(ProgressListener.Phase.WALK, i + 1, total, s.label());
        }

        // ---- 3) 저장 ----
        pl.onProgress(ProgressListener.Phase.PERSIST, 0, 1, output.toString());
        Corpus corpus = store.toCorpus(Instant.now(clock).toString(), labels);
        store.persist(output, corpus);
        pl.onProgress(ProgressListener.Phase.PERSIST, 1, 1, output.toString());

        CorpusSummary summary = CorpusSummary.of(corpus);
        FetchStats.Snapshot fs = (fetcher instanceof HttpFetcher hf) ? hf.getStats() : null;
        HarvestSummary result = new HarvestSummary(output, reports, resumed, dropped,
                store.getAddedCount(), store.getReplacedCount(), summary, fs);

        LOG.info("Harvest done. total={}, added={}, replaced={}, abandonedSteps={}, perYear={}",
                summary.total(), result.added(), result.replaced(), result.abandonedSteps(),
                summary.perPartition());
        SLOG.info("harvest-done",
                "total", summary.total(),
                "added", result.added(),
                "replaced", result.replaced(),
                "skipped", store.getSkippedCount(),
                "rejected", store.getRejectedCount(),
                "abandonedSteps", result.abandonedSteps(),
                "networkCalls", fs == null ? -1 : fs.networkCalls,
                "cacheHits", fs == null ? -1 : fs.cacheHits);
        return result;
    }

    public HarvestConfig getConfig() {
        return config;
    }
}
