package com.quizharvester.app.cli;

import com.quizharvester.core.config.HarvestConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * HarvestApp 명령행 옵션. 지정된 값만 YAML 설정 위에 덮어쓴다.
 * 값이 필요한 옵션은 "--key value" 와 "--key=value" 둘 다 허용.
 */
public final class HarvestArgs {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: harvest [options]",
            "  --config <file>       harvest.yml path (default: ./harvest.yml if present)",
            "  --sessions <a,b|all>  session labels to harvest",
            "  --out <file>          output corpus path",
            "  --base-url <url>      landing page URL",
            "  --throttle <ms>       minimum interval between requests",
            "  --max-retries <n>     total attempts per request",
            "  --max-qno <n>         steps per session",
            "  --no-cache            disable the response cache",
            "  --cache-dir <dir>     response cache directory",
            "  --resume              continue from the existing output",
            "  --prefer-new          replace records with the same id",
            "  --debug-pages [dir]   save raw pages for diagnosis",
            "  --list-sessions       print the sessions offered by the site and exit",
            "  --verbose             FINE logging",
            "  -h, --help            this text");

    private Path config;
    private List<String> sessions;
    private Path out;
    private String baseUrl;
    private Long throttleMs;
    private Integer maxRetries;
    private Integer maxSteps;
    private boolean noCache;
    private Path cacheDir;
    private boolean resume;
    private boolean preferNew;
    private boolean debugPages;
    private Path debugDir;
    private boolean listSessions;
    private boolean verbose;
    private boolean help;

    private HarvestArgs() {}

    /** @throws IllegalArgumentException 모르는 옵션, 값 누락, 숫자 형식 오류 */
    public static HarvestArgs parse(String... args) {
        HarvestArgs a = new HarvestArgs();
        List<String> in = new ArrayList<>();
        for (String s : args) {
            // --key=value 분해
            int eq = s.indexOf('=');
            if (s.startsWith("--") && eq > 2) {
                in.add(s.substring(0, eq));
                in.add(s.substring(eq + 1));
            } else {
                in.add(s);
            }
        }

        for (int i = 0; i < in.size(); i++) {
            String opt = in.get(i);
            switch (opt) {
                case "--config" -> a.config = Path.of(value(in, ++i, opt));
                case "--sessions" -> a.sessions = splitList(value(in, ++i, opt));
                case "--out" -> a.out = Path.of(value(in, ++i, opt));
                case "--base-url" -> a.baseUrl = value(in, ++i, opt);
                case "--throttle" -> a.throttleMs = (long) intValue(in, ++i, opt);
                case "--max-retries" -> a.maxRetries = intValue(in, ++i, opt);
                case "--max-qno" -> a.maxSteps = intValue(in, ++i, opt);
                case "--no-cache" -> a.noCache = true;
                case "--cache-dir" -> a.cacheDir = Path.of(value(in, ++i, opt));
                case "--resume" -> a.resume = true;
                case "--prefer-new" -> a.preferNew = true;
                case "--debug-pages" -> {
                    a.debugPages = true;
                    // 디렉터리 인자는 선택
                    if (i + 1 < in.size() && !in.get(i + 1).startsWith("-")) {
                        a.debugDir = Path.of(in.get(++i));
                    }
                }
                case "--list-sessions" -> a.listSessions = true;
                case "--verbose", "-v" -> a.verbose = true;
                case "--help", "-h" -> a.help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + opt);
            }
        }
        return a;
    }

    /** YAML(또는 기본값) 위에 명령행 값을 덮어쓴 뒤 validate */
    public HarvestConfig applyTo(HarvestConfig cfg) {
        if (baseUrl != null) cfg.setBaseUrl(baseUrl);
        if (sessions != null) cfg.setSessions(sessions);
        if (out != null) cfg.setOutput(out);
        if (throttleMs != null) cfg.setThrottleMs(throttleMs);
        if (maxRetries != null) cfg.setMaxRetries(maxRetries);
        if (maxSteps != null) cfg.setMaxSteps(maxSteps);
        if (noCache) cfg.getCache().setEnabled(false);
        if (cacheDir != null) cfg.getCache().setDir(cacheDir);
        if (resume) cfg.setResume(true);
        if (preferNew) cfg.setPreferNew(true);
        if (debugPages) cfg.setDebugPages(true);
        if (debugDir != null) cfg.setDebugDir(debugDir);
        cfg.validate();
        return cfg;
    }

    // ---------- getters ----------
    public Path config() { return config; }
    public boolean listSessions() { return listSessions; }
    public boolean verbose() { return verbose; }
    public boolean help() { return help; }

    // ---------- helpers ----------
    private static String value(List<String> in, int i, String opt) {
        if (i >= in.size() || in.get(i).isBlank()) {
            throw new IllegalArgumentException("Missing value for " + opt);
        }
        return in.get(i);
    }

    private static int intValue(List<String> in, int i, String opt) {
        String v = value(in, i, opt);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " must be an integer: " + v, e);
        }
    }

    private static List<String> splitList(String v) {
        List<String> out = new ArrayList<>();
        for (String p : v.split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        if (out.isEmpty()) throw new IllegalArgumentException("--sessions must not be empty");
        return List.copyOf(out);
    }
}
