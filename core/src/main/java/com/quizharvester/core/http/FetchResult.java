package com.quizharvester.core.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 페치 결과. JSON 응답이면 {@link #json()}이, 그 외에는 {@link #text()}가 본문.
 * 캐시 히트는 status=200, requestBody=null.
 */
public final class FetchResult {
    private final int status;
    private final byte[] raw;
    private final String text;
    private final JsonNode json;
    private final String requestBody;
    private final boolean fromCache;

    FetchResult(int status, byte[] raw, String text, JsonNode json, String requestBody, boolean fromCache) {
        this.status = status;
        this.raw = (raw == null) ? new byte[0] : raw;
        this.text = (text == null) ? "" : text;
        this.json = json;
        this.requestBody = requestBody;
        this.fromCache = fromCache;
    }

    /** HttpFetcher 외의 IFetcher 구현(가짜 사이트 등)용: 텍스트 본문 응답 */
    public static FetchResult ofText(int status, String text, String requestBody) {
        String t = (text == null) ? "" : text;
        return new FetchResult(status, t.getBytes(StandardCharsets.UTF_8), t, null, requestBody, false);
    }

    public int status() { return status; }
    public byte[] raw() { return Arrays.copyOf(raw, raw.length); }
    public String text() { return text; }
    public JsonNode json() { return json; }
    public boolean isJson() { return json != null; }
    public String requestBody() { return requestBody; }
    public boolean fromCache() { return fromCache; }

    /** 디코딩된 내용: JSON이면 JsonNode, 아니면 String */
    public Object content() {
        return json != null ? json : text;
    }
}
