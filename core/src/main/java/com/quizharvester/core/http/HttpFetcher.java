package com.quizharvester.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quizharvester.core.api.IFetcher;
import com.quizharvester.core.config.HarvestConfig;
import com.quizharvester.core.model.FetchStats;
import com.quizharvester.core.util.Sleeper;
import com.quizharvester.core.util.StructuredLog;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.LongSupplier;

/**
 * 스로틀 + 지수 백오프 재시도 + 디스크 캐시를 갖춘 HTTP 페처.
 * <ol>
 *   <li>캐시 히트면 네트워크/스로틀 없이 즉시 반환</li>
 *   <li>미스면 스로틀(인스턴스 공용 시계) 후 송신</li>
 *   <li>429/5xx/전송 실패는 base, base*2, ... 간격으로 재시도, 상한 초과 시 마지막 실패를 던짐</li>
 *   <li>그 외 non-2xx는 즉시 실패</li>
 *   <li>성공 본문은 Content-Type과 무관하게 원본 바이트로 캐시</li>
 * </ol>
 */
public class HttpFetcher implements IFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private static final StructuredLog SLOG = StructuredLog.get(HttpFetcher.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HarvestConfig config;
    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final MinIntervalThrottle throttle;
    private final ResponseCache cache;   // null이면 캐시 비활성
    private final FetchStats stats = new FetchStats();

    public HttpFetcher(HarvestConfig config) throws IOException {
        this(config, defaultSender(config), Sleeper.SYSTEM, System::nanoTime);
    }

    /** 테스트용 생성자(송신 훅/대기/시계 주입) */
    public HttpFetcher(HarvestConfig config, HttpSender sender, Sleeper sleeper, LongSupplier nanoClock) throws IOException {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.retryPolicy = BackoffRetryPolicy.of(config);
        this.throttle = new MinIntervalThrottle(config.getThrottle(), sleeper, nanoClock);
        this.cache = config.getCache().isEnabled() ? new ResponseCache(config.getCache().getDir()) : null;
    }

    private static HttpSender defaultSender(HarvestConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    @Override
    public FetchResult fetch(FetchRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        String key = (cache != null) ? RequestFingerprint.of(request) : null;

        if (key != null) {
            Optional<byte[]> hit = cache.get(key);
            if (hit.isPresent()) {
                stats.addCacheHit();
                SLOG.debug("fetch-cache-hit", "url", request.getUrl(), "key", key);
                byte[] bytes = hit.get();
                String text = new String(bytes, StandardCharsets.UTF_8);
                return new FetchResult(200, bytes, text, parseContainerOrNull(text), null, true);
            }
        }

        throttle.acquire();

        String body = encodeBody(request);
        HttpRequest httpReq = buildRequest(request, body);
        HttpResponse<byte[]> resp = sendWithRetry(request, httpReq);

        byte[] bytes = (resp.body() == null) ? new byte[0] : resp.body();
        if (key != null) {
            cache.putIfAbsent(key, bytes);
        }

        String text = new String(bytes, StandardCharsets.UTF_8);
        String contentType = resp.headers().firstValue("Content-Type").orElse("");
        JsonNode json = isJsonType(contentType) ? parseOrNull(text) : null;
        return new FetchResult(resp.statusCode(), bytes, text, json,
                request.isRawResponse() ? body : null, false);
    }

    private HttpResponse<byte[]> sendWithRetry(FetchRequest request, HttpRequest httpReq)
            throws FetchException, InterruptedException {
        int attempt = 1;
        while (true) {
            HttpResponse<byte[]> resp = null;
            IOException transportError = null;
            int status;
            try {
                resp = sender.send(httpReq);
                status = resp.statusCode();
            } catch (IOException e) {
                transportError = e;
                status = -1;
            }
            stats.addNetworkCall();

            if (status >= 200 && status < 300) {
                stats.addRetries(attempt - 1);
                return resp;
            }

            if (!retryPolicy.shouldRetry(status, attempt)) {
                stats.addRetries(attempt - 1);
                stats.addFailure();
                String msg = RetryPolicy.isRetryableStatus(status)
                        ? "giving up after " + attempt + " attempt(s): " + describe(status, transportError)
                        : "non-retryable " + describe(status, transportError);
                SLOG.warn("fetch-failed", "url", request.getUrl(), "status", status, "attempts", attempt);
                throw new FetchException(msg + " for " + request.getUrl(), request.getUrl(), status, attempt, transportError);
            }

            Optional<Duration> retryAfter = (resp == null)
                    ? Optional.empty()
                    : RetryPolicy.parseRetryAfter(resp.headers().firstValue("Retry-After").orElse(null));
            Duration delay = retryPolicy.delayAfter(attempt, retryAfter);
            SLOG.info("fetch-retry", "url", request.getUrl(), "status", status,
                    "attempt", attempt, "delayMs", delay.toMillis());
            sleeper.sleep(delay);
            attempt++;
        }
    }

    private static String describe(int status, IOException transportError) {
        if (status == -1) {
            return "transport failure (" + (transportError == null ? "unknown" : transportError.getClass().getSimpleName()) + ")";
        }
        return "HTTP " + status;
    }

    private HttpRequest buildRequest(FetchRequest request, String body) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(withQuery(request)))
                .timeout(config.getTimeout());
        for (Map.Entry<String, String> h : request.getHeaders().entrySet()) {
            b.header(h.getKey(), h.getValue());
        }
        if (body == null) {
            b.method(request.getMethod(), HttpRequest.BodyPublishers.noBody());
        } else {
            if (!hasHeader(request, "Content-Type")) {
                b.header("Content-Type", request.getJsonBody() != null
                        ? "application/json"
                        : "application/x-www-form-urlencoded; charset=UTF-8");
            }
            b.method(request.getMethod(), HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }
        return b.build();
    }

    private static boolean hasHeader(FetchRequest request, String name) {
        for (String k : request.getHeaders().keySet()) {
            if (k.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    static String withQuery(FetchRequest request) {
        if (request.getQuery().isEmpty()) return request.getUrl();
        String sep = request.getUrl().contains("?") ? "&" : "?";
        return request.getUrl() + sep + urlEncode(request.getQuery());
    }

    static String encodeBody(FetchRequest request) {
        if (request.getJsonBody() != null) {
            try {
                return JSON.writeValueAsString(request.getJsonBody());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("jsonBody is not serializable", e);
            }
        }
        if (request.getForm().isEmpty()) return null;
        return urlEncode(request.getForm());
    }

    static String urlEncode(List<FetchRequest.Param> params) {
        StringJoiner sj = new StringJoiner("&");
        for (FetchRequest.Param p : params) {
            sj.add(URLEncoder.encode(p.name(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(p.value(), StandardCharsets.UTF_8));
        }
        return sj.toString();
    }

    private static boolean isJsonType(String contentType) {
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("application/json") || ct.contains("+json");
    }

    private static JsonNode parseOrNull(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            SLOG.warn("fetch-json-invalid", "message", e.getOriginalMessage());
            return null;
        }
    }

    /** 캐시 본문: 객체/배열로 파싱될 때만 JSON 취급(HTML/숫자 문자열 오판 방지) */
    private static JsonNode parseContainerOrNull(String text) {
        String t = text.stripLeading();
        if (t.isEmpty() || (t.charAt(0) != '{' && t.charAt(0) != '[')) return null;
        try {
            JsonNode n = JSON.readTree(t);
            return (n != null && n.isContainerNode()) ? n : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public FetchStats.Snapshot getStats() {
        return stats.snapshot();
    }

    public boolean isCacheEnabled() {
        return cache != null;
    }
}
