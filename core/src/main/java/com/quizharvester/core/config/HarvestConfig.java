package com.quizharvester.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 수집 설정 (harvest.yml 매핑 대상) — 순수 설정 보관용.
 * CLI 플래그는 YAML 로딩 후 덮어쓴다.
 */
public final class HarvestConfig {

    /** HTTP 캐시 관련 하위 설정: YAML의 `cache:` 섹션과 매핑 */
    public static final class CacheCfg {
        private boolean enabled = true;
        private Path dir = Path.of(".cache", "http");

        public boolean isEnabled() { return enabled; }
        public CacheCfg setEnabled(boolean enabled) { this.enabled = enabled; return this; }

        public Path getDir() { return dir; }
        public CacheCfg setDir(Path dir) { this.dir = dir; return this; }
    }

    /** 세션 워커 하위 설정: YAML의 `walker:` 섹션과 매핑 */
    public static final class WalkerCfg {
        private int stallRetries = 3;              // 같은 스텝 재시도 예산
        private Duration stallPause = Duration.ofSeconds(1);
        private String idPrefix = "ap-";           // 합성 id 접두어 → ap-2024-q001
        private String markerFormat = "第%d問";     // 다음 스텝(1-base) 표식
        private int examCount = 40;                // moshi_cnt

        public int getStallRetries() { return stallRetries; }
        public WalkerCfg setStallRetries(int v) { this.stallRetries = v; return this; }

        public Duration getStallPause() { return stallPause; }
        public WalkerCfg setStallPause(Duration v) { this.stallPause = v; return this; }

        public String getIdPrefix() { return idPrefix; }
        public WalkerCfg setIdPrefix(String v) { this.idPrefix = (v == null ? "" : v); return this; }

        public String getMarkerFormat() { return markerFormat; }
        public WalkerCfg setMarkerFormat(String v) { this.markerFormat = v; return this; }

        public int getExamCount() { return examCount; }
        public WalkerCfg setExamCount(int v) { this.examCount = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String baseUrl = "https://www.ap-siken.com/apkakomon.php";
    private List<String> sessions = List.of("all");
    private Path output = Path.of("data", "questions_seed.json");

    private Duration throttle = Duration.ofSeconds(1);   // 요청 간 최소 간격
    private int maxRetries = 5;                           // 첫 시도 포함 최대 시도 수
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration timeout = Duration.ofSeconds(20);
    private int maxSteps = 80;                            // 세션당 스텝 상한(qno 0..maxSteps-1)
    private boolean resume = false;
    private boolean preferNew = false;
    private boolean debugPages = false;
    private Path debugDir = Path.of("debug_pages");

    private CacheCfg cache = new CacheCfg();
    private final WalkerCfg walker = new WalkerCfg();

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public List<String> getSessions() { return sessions; }
    public Path getOutput() { return output; }
    public Duration getThrottle() { return throttle; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public Duration getTimeout() { return timeout; }
    public int getMaxSteps() { return maxSteps; }
    public boolean isResume() { return resume; }
    public boolean isPreferNew() { return preferNew; }
    public boolean isDebugPages() { return debugPages; }
    public Path getDebugDir() { return debugDir; }
    public CacheCfg getCache() { return cache; }
    public WalkerCfg walker() { return walker; }

    // ---------- fluent setters ----------
    public HarvestConfig setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
    public HarvestConfig setSessions(List<String> sessions) {
        if (sessions != null && !sessions.isEmpty()) this.sessions = List.copyOf(sessions);
        return this;
    }
    public HarvestConfig setOutput(Path output) { this.output = output; return this; }
    public HarvestConfig setThrottle(Duration throttle) { this.throttle = throttle; return this; }
    public HarvestConfig setThrottleMs(long ms) { this.throttle = Duration.ofMillis(Math.max(0, ms)); return this; }
    public HarvestConfig setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
    public HarvestConfig setRetryBaseDelay(Duration d) { this.retryBaseDelay = d; return this; }
    public HarvestConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public HarvestConfig setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; return this; }
    public HarvestConfig setResume(boolean resume) { this.resume = resume; return this; }
    public HarvestConfig setPreferNew(boolean preferNew) { this.preferNew = preferNew; return this; }
    public HarvestConfig setDebugPages(boolean debugPages) { this.debugPages = debugPages; return this; }
    public HarvestConfig setDebugDir(Path debugDir) { this.debugDir = debugDir; return this; }
    public HarvestConfig setCache(CacheCfg cache) { this.cache = (cache != null ? cache : new CacheCfg()); return this; }

    /** "all" 이면 발견된 전 회차 */
    public boolean isAllSessions() {
        return sessions.size() == 1 && "all".equalsIgnoreCase(sessions.get(0).trim());
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl must not be blank");
        Objects.requireNonNull(output, "output");
        if (throttle == null || throttle.isNegative())
            throw new IllegalArgumentException("throttle must be >= 0");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        if (retryBaseDelay == null || retryBaseDelay.isNegative())
            throw new IllegalArgumentException("retryBaseDelay must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must be >= 0");

        Objects.requireNonNull(cache, "cache");
        if (cache.isEnabled()) Objects.requireNonNull(cache.getDir(), "cache.dir");
        if (debugPages) Objects.requireNonNull(debugDir, "debugDir");

        if (walker.getStallRetries() < 1)
            throw new IllegalArgumentException("walker.stallRetries must be >= 1");
        if (walker.getStallPause() == null || walker.getStallPause().isNegative())
            throw new IllegalArgumentException("walker.stallPause must be >= 0");
        if (walker.getMarkerFormat() == null || !walker.getMarkerFormat().contains("%d"))
            throw new IllegalArgumentException("walker.markerFormat must contain %d");
        if (walker.getExamCount() < 1)
            throw new IllegalArgumentException("walker.examCount must be >= 1");
    }

    // ---------- helpers ----------
    public static HarvestConfig defaults() { return new HarvestConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
