package com.quizharvester.core.walker;

import com.quizharvester.core.api.IFetcher;
import com.quizharvester.core.api.IQuestionExtractor;
import com.quizharvester.core.config.HarvestConfig;
import com.quizharvester.core.extract.QuestionIds;
import com.quizharvester.core.http.FetchRequest;
import com.quizharvester.core.model.CarrySet;
import com.quizharvester.core.model.QuestionRecord;
import com.quizharvester.core.model.SessionMeta;
import com.quizharvester.core.store.QuestionStore;
import com.quizharvester.core.util.Sleeper;
import com.quizharvester.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 세션 1개를 qno 0..maxSteps-1 순서로 끝까지 밟는 상태 기계.
 * <ul>
 *   <li>STARTING: 랜딩 GET → sid 추출(없으면 {@link MissingSessionIdException}), startTime 고정</li>
 *   <li>STEPPING: sid/qno/startTime/carry set으로 폼 POST</li>
 *   <li>응답에 다음 문항 표식(第{qno+1}問)이 있으면 ADVANCING, 없으면 STALLED</li>
 *   <li>ADVANCING: 추출 → id 부여 → Store 투입 → 응답의 hidden 토큰으로 carry set 교체</li>
 *   <li>STALLED: 같은 qno를 같은 carry set으로 재시도, 예산 소진 시 포기하고 다음 qno로(carry set 유지)</li>
 * </ul>
 * 사이트가 종료 신호를 주지 않으므로 항상 maxSteps까지 진행한다.
 * 스텝 N+1은 스텝 N의 응답 처리 후에만 보낸다(토큰 의존).
 */
public final class SessionWalker {

    private static final Logger LOG = LoggerFactory.getLogger(SessionWalker.class);
    private static final StructuredLog SLOG = StructuredLog.get(SessionWalker.class);

    private final IFetcher fetcher;
    private final IQuestionExtractor extractor;
    private final QuestionStore store;
    private final Sleeper sleeper;
    private final LongSupplier epochSeconds;
    private final DebugSnapshots snapshots;

    private final int stallRetries;
    private final Duration stallPause;
    private final String markerFormat;
    private final String idPrefix;
    private final StepRequestBuilder requests;

    private volatile WalkState state = WalkState.DONE;

    public SessionWalker(IFetcher fetcher, IQuestionExtractor extractor, QuestionStore store, HarvestConfig config) {
        this(fetcher, extractor, store, config, Sleeper.SYSTEM,
                () -> System.currentTimeMillis() / 1000L,
                config.isDebugPages() ? new FileDebugSnapshots(config.getDebugDir()) : DebugSnapshots.NONE);
    }

    /** 테스트용(대기/시계/스냅샷 주입) */
    public SessionWalker(IFetcher fetcher, IQuestionExtractor extractor, QuestionStore store, HarvestConfig config,
                         Sleeper sleeper, LongSupplier epochSeconds, DebugSnapshots snapshots) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.store = Objects.requireNonNull(store, "store");
        Objects.requireNonNull(config, "config");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.epochSeconds = Objects.requireNonNull(epochSeconds, "epochSeconds");
        this.snapshots = (snapshots != null) ? snapshots : DebugSnapshots.NONE;

        HarvestConfig.WalkerCfg w = config.walker();
        this.stallRetries = Math.max(1, w.getStallRetries());
        this.stallPause = w.getStallPause();
        this.markerFormat = w.getMarkerFormat();
        this.idPrefix = w.getIdPrefix();
        this.requests = new StepRequestBuilder(w.getExamCount());
    }

    /**
     * @return 스텝별 결과. 수락된 레코드는 Store에 이미 반영되어 있다.
     * @throws MissingSessionIdException 랜딩 페이지에 sid가 없을 때
     * @throws IOException               랜딩 페이지 페치 실패
     */
    public WalkReport walk(SessionMeta session, int maxSteps) throws IOException, InterruptedException {
        Objects.requireNonNull(session, "session");

        // ---- STARTING ----
        state = WalkState.STARTING;
        String landing = fetcher.fetch(FetchRequest.get(session.baseUrl()).build()).text();
        String sid = HiddenTokenParser.sessionId(landing)
                .orElseThrow(() -> new MissingSessionIdException(session.label(), session.baseUrl()));
        String startTime = String.valueOf(epochSeconds.getAsLong());
        Integer totalHint = HiddenTokenParser.totalQuestionHint(landing);

        LOG.info("Session start: label={}, year={}, times={}, maxSteps={}",
                session.label(), session.year(), session.timesCode(), maxSteps);
        SLOG.info("session-start", "label", session.label(), "year", session.year(),
                "sid", sid, "startTime", startTime, "maxSteps", maxSteps);

        CarrySet carry = CarrySet.initial();
        List<StepOutcome> outcomes = new ArrayList<>(Math.max(0, maxSteps));

        for (int qno = 0; qno < maxSteps; qno++) {
            state = WalkState.STEPPING;
            String marker = String.format(Locale.ROOT, markerFormat, qno + 1);
            StepOutcome outcome = null;
            int attempt = 0;

            while (attempt < stallRetries) {
                attempt++;
                if (attempt > 1) sleeper.sleep(stallPause);

                FetchRequest req = requests.build(session, sid, qno, startTime, carry, attempt);
                String html;
                try {
                    var res = fetcher.fetch(req);
                    html = res.text();
                    snapshot(session, qno, "request.txt", res.requestBody());
                } catch (IOException e) {
                    // 스텝 시도 1회 실패로 집계(페처 자체 재시도와는 별개 예산)
                    state = WalkState.STALLED;
                    SLOG.warn("step-fetch-failed", "label", session.label(), "qno", qno,
                            "attempt", attempt, "error", e.getMessage());
                    continue;
                }
                snapshot(session, qno, "response.html", html);
                if (totalHint == null) {
                    totalHint = HiddenTokenParser.totalQuestionHint(html);
                    if (totalHint != null) SLOG.info("total-hint", "label", session.label(), "total", totalHint);
                }

                if (html.contains(marker)) {
                    state = WalkState.ADVANCING;
                    outcome = advance(session, qno, attempt, html);
                    carry = HiddenTokenParser.carrySet(html).forContinue();
                    break;
                }

                state = WalkState.STALLED;
                SLOG.info("step-stalled", "label", session.label(), "qno", qno,
                        "attempt", attempt, "marker", marker);
                snapshot(session, qno, "stalled.html", html);
            }

            if (outcome == null) {
                // carry set은 정체 이전 값 그대로
                outcome = StepOutcome.abandoned(qno, attempt);
                LOG.warn("qno={} still not advancing after {} attempt(s); skipped", qno, attempt);
                SLOG.warn("step-abandoned", "label", session.label(), "qno", qno, "attempts", attempt);
            }
            outcomes.add(outcome);
        }

        state = WalkState.DONE;
        WalkReport report = new WalkReport(session, outcomes, totalHint);
        LOG.info("Session done: label={}, accepted={}, abandoned={}, storeSize={}",
                session.label(), report.acceptedRecords(), report.abandonedSteps().size(), store.size());
        return report;
    }

    private StepOutcome advance(SessionMeta session, int qno, int attempt, String html) {
        List<QuestionRecord> candidates;
        try {
            candidates = extractor.extract(html, session);
        } catch (RuntimeException e) {
            SLOG.error("extract-failed", e, "label", session.label(), "qno", qno);
            candidates = null;
        }
        if (candidates == null || candidates.isEmpty()) {
            SLOG.warn("step-empty", "label", session.label(), "qno", qno);
            snapshot(session, qno, "empty.html", html);
            return StepOutcome.advanced(qno, attempt, 0, 0);
        }

        int accepted = 0;
        for (QuestionRecord candidate : candidates) {
            if (candidate == null) continue;
            QuestionRecord rec = candidate.hasId()
                    ? candidate
                    : candidate.withId(QuestionIds.format(idPrefix, session.year(), store.nextSequence(session.year())));
            if (rec.isAnswerUnknown()) {
                SLOG.warn("answer-missing", "label", session.label(), "qno", qno, "id", rec.id());
            }
            if (store.add(rec)) accepted++;
        }
        SLOG.info("step-advanced", "label", session.label(), "qno", qno, "attempt", attempt,
                "offered", candidates.size(), "accepted", accepted);
        return StepOutcome.advanced(qno, attempt, candidates.size(), accepted);
    }

    private void snapshot(SessionMeta session, int qno, String kind, String content) {
        if (snapshots == DebugSnapshots.NONE || content == null) return;
        try {
            snapshots.save(session.label(), qno, kind, content);
        } catch (IOException e) {
            LOG.warn("debug snapshot failed ({} qno={} {}): {}", session.label(), qno, kind, e.toString());
        }
    }

    /** 마지막으로 진입한 상태(진단용) */
    public WalkState state() {
        return state;
    }
}
