package com.quizharvester.app;

import com.quizharvester.core.store.CorpusMerger;
import com.quizharvester.core.store.CorpusSummary;
import com.quizharvester.core.store.MergeResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * 새로 수집한 코퍼스를 시드 파일에 합친다(결과는 시드에 원자적으로 덮어씀).
 * 사용: --seed S --incoming I [--prefer-new]
 */
public final class SeedUpdateTool {

    static final String USAGE = "Usage: seed-update --seed <file> --incoming <file> [--prefer-new]";

    private SeedUpdateTool() {}

    public static void main(String[] args) {
        int code = run(System.out, System.err, args);
        if (code != 0) System.exit(code);
    }

    static int run(PrintStream out, PrintStream err, String... args) {
        Path seed = null;
        Path incoming = null;
        boolean preferNew = false;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--seed" -> seed = (i + 1 < args.length) ? Path.of(args[++i]) : null;
                case "--incoming" -> incoming = (i + 1 < args.length) ? Path.of(args[++i]) : null;
                case "--prefer-new" -> preferNew = true;
                default -> {
                    err.println("Unknown option: " + a);
                    err.println(USAGE);
                    return 2;
                }
            }
        }
        if (seed == null || incoming == null) {
            err.println(USAGE);
            return 2;
        }

        try {
            MergeResult r = new CorpusMerger().mergeCorpora(seed, incoming, preferNew);
            CorpusSummary s = CorpusSummary.of(r.merged());
            out.printf("Added: %d, Replaced: %d, Total: %d%n", r.addedCount(), r.replacedCount(), s.total());
            out.println("Per-year: " + s.perPartition());
            out.println("Per-category: " + s.perCategory());
            if (!r.droppedIds().isEmpty()) {
                out.println("Dropped from seed: " + r.droppedIds());
            }
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            // 신규 파일 검증 실패 포함. 시드는 손대지 않음
            err.println("Merge failed: " + e.getMessage());
            return 1;
        }
    }
}
