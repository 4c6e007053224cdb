package com.quizharvester.app;

import com.quizharvester.app.cli.HarvestArgs;
import com.quizharvester.app.logging.LogSetup;
import com.quizharvester.core.config.HarvestConfig;
import com.quizharvester.core.model.SessionMeta;
import com.quizharvester.core.service.HarvestService;
import com.quizharvester.core.service.HarvestSummary;
import com.quizharvester.core.store.ValidationException;
import com.quizharvester.core.util.YamlConfigLoader;
import com.quizharvester.core.walker.WalkReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;

/**
 * 수집 CLI.
 * 종료 코드: 0 성공, 1 실행 실패(네트워크/검증/sid 없음), 2 잘못된 인자
 */
public final class HarvestApp {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /** 설정 → 서비스. 테스트에서 가짜 페처를 끼우는 지점 */
    @FunctionalInterface
    interface ServiceFactory {
        HarvestService create(HarvestConfig config) throws IOException;
    }

    private final ServiceFactory factory;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean setupLogging;

    HarvestApp(ServiceFactory factory, PrintStream out, PrintStream err, boolean setupLogging) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.setupLogging = setupLogging;
    }

    public static void main(String[] args) {
        int code = new HarvestApp(HarvestService::new, System.out, System.err, true).run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    int run(String... args) {
        final HarvestArgs opts;
        final HarvestConfig cfg;
        try {
            opts = HarvestArgs.parse(args);
            if (opts.help()) {
                out.println(HarvestArgs.USAGE);
                return EXIT_OK;
            }
            HarvestConfig base = (opts.config() != null)
                    ? YamlConfigLoader.load(opts.config())
                    : YamlConfigLoader.loadDefault();
            cfg = opts.applyTo(base);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(HarvestArgs.USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (setupLogging) {
            Path parent = cfg.getOutput().toAbsolutePath().getParent();
            LogSetup.configure(parent != null ? parent : Path.of("."));
            if (opts.verbose()) LogSetup.setLevel(Level.FINE);
        }

        try {
            HarvestService service = factory.create(cfg);
            if (opts.listSessions()) {
                printSessions(service.listSessions());
                return EXIT_OK;
            }
            HarvestSummary summary = service.run((phase, done, total, detail) ->
                    LOG.info("[{}] {}/{} {}", phase, done, total, detail));
            printSummary(summary);
            return EXIT_OK;
        } catch (ValidationException e) {
            // 레코드/코퍼스 검증 실패는 인자 문제가 아니다
            LOG.error("Harvest failed: {}", e.toString(), e);
            err.println("Harvest failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            // 모르는 회차 라벨 등
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            LOG.error("Harvest failed: {}", e.toString(), e);
            err.println("Harvest failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILURE;
        }
    }

    private void printSessions(Map<String, SessionMeta> sessions) {
        if (sessions.isEmpty()) {
            out.println("No sessions found.");
            return;
        }
        sessions.values().forEach(s ->
                out.printf("%s\t%d\t%s%n", s.label(), s.year(), s.timesCode()));
    }

    private void printSummary(HarvestSummary s) {
        out.println();
        out.println("Scrape complete.");
        out.println("Output: " + s.output().toAbsolutePath());
        for (WalkReport r : s.reports()) {
            out.printf("  %s: accepted=%d, abandoned=%s%n",
                    r.session().label(), r.acceptedRecords(), r.abandonedSteps());
        }
        if (s.resumedCount() > 0 || !s.droppedIds().isEmpty()) {
            out.printf("Resumed: %d (dropped %d)%n", s.resumedCount(), s.droppedIds().size());
        }
        out.printf("Added: %d, Replaced: %d%n", s.added(), s.replaced());
        out.println("Total questions: " + s.corpus().total());
        out.println("Per-year:");
        s.corpus().perPartition().forEach((year, n) -> out.printf("  %d: %d%n", year, n));
        out.println("Per-category:");
        s.corpus().perCategory().forEach((cat, n) -> out.printf("  %s: %d%n", cat, n));
        if (s.fetchStats() != null) {
            out.printf("Requests: network=%d, cacheHits=%d, retries=%d%n",
                    s.fetchStats().networkCalls, s.fetchStats().cacheHits, s.fetchStats().retriesTotal);
        }
    }
}
