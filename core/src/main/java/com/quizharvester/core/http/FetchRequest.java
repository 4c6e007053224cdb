package com.quizharvester.core.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 페처 요청 명세.
 * - form/query는 키 중복(times[], categories[] 등)이 있어 순서 있는 쌍 목록으로 보관
 * - jsonBody가 있으면 form보다 우선해 JSON으로 송신
 * - cacheKey가 있으면 지문 대신 그대로 캐시 키로 사용
 * - rawResponse=true면 호출자가 상태코드/요청 본문까지 필요로 한다는 표시
 */
public final class FetchRequest {

    /** 순서 있는 key=value 쌍 */
    public record Param(String name, String value) {
        public Param {
            Objects.requireNonNull(name, "name");
            value = (value == null) ? "" : value;
        }
    }

    private final String method;
    private final String url;
    private final List<Param> query;
    private final List<Param> form;
    private final Map<String, Object> jsonBody;
    private final Map<String, String> headers;
    private final String cacheKey;
    private final boolean rawResponse;

    private FetchRequest(Builder b) {
        this.method = b.method;
        this.url = b.url;
        this.query = Collections.unmodifiableList(new ArrayList<>(b.query));
        this.form = Collections.unmodifiableList(new ArrayList<>(b.form));
        this.jsonBody = (b.jsonBody == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.jsonBody));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.cacheKey = b.cacheKey;
        this.rawResponse = b.rawResponse;
    }

    public String getMethod() { return method; }
    public String getUrl() { return url; }
    public List<Param> getQuery() { return query; }
    public List<Param> getForm() { return form; }
    public Map<String, Object> getJsonBody() { return jsonBody; }
    public Map<String, String> getHeaders() { return headers; }
    public String getCacheKey() { return cacheKey; }
    public boolean isRawResponse() { return rawResponse; }

    public boolean hasBody() {
        return jsonBody != null || !form.isEmpty();
    }

    public static Builder get(String url) { return new Builder("GET", url); }
    public static Builder post(String url) { return new Builder("POST", url); }

    public static final class Builder {
        private final String method;
        private final String url;
        private final List<Param> query = new ArrayList<>();
        private final List<Param> form = new ArrayList<>();
        private Map<String, Object> jsonBody;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String cacheKey;
        private boolean rawResponse;

        public Builder(String method, String url) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            this.url = Objects.requireNonNull(url, "url");
        }

        public Builder query(String name, String value) { query.add(new Param(name, value)); return this; }
        public Builder form(String name, String value) { form.add(new Param(name, value)); return this; }
        public Builder form(List<Param> params) { form.addAll(params); return this; }
        public Builder jsonBody(Map<String, Object> body) { this.jsonBody = body; return this; }
        public Builder header(String name, String value) { headers.put(name, value); return this; }
        public Builder cacheKey(String key) { this.cacheKey = key; return this; }
        public Builder rawResponse(boolean v) { this.rawResponse = v; return this; }

        public FetchRequest build() {
            return new FetchRequest(this);
        }
    }
}
