package com.quizharvester.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quizharvester.core.util.Fingerprints;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 요청 지문(캐시 키).
 * - 명시적 cacheKey가 있으면 그대로 사용
 * - 없으면 URL + 키 정렬된 query + 키 정렬된 body(form 또는 JSON)의 SHA-256
 * 같은 키 안의 값 순서는 보존한다(배열 파라미터 의미 유지).
 */
public final class RequestFingerprint {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private RequestFingerprint() {}

    public static String of(FetchRequest req) {
        String explicit = req.getCacheKey();
        if (explicit != null && !explicit.isBlank()) return explicit;

        String query = req.getQuery().isEmpty() ? null : canonical(group(req.getQuery()));
        String body = null;
        if (req.getJsonBody() != null) {
            body = canonical(req.getJsonBody());
        } else if (!req.getForm().isEmpty()) {
            body = canonical(group(req.getForm()));
        }
        return Fingerprints.sha256Hex(req.getUrl(), query, body);
    }

    private static Map<String, List<String>> group(List<FetchRequest.Param> params) {
        Map<String, List<String>> sorted = new TreeMap<>();
        for (FetchRequest.Param p : params) {
            sorted.computeIfAbsent(p.name(), k -> new ArrayList<>()).add(p.value());
        }
        return sorted;
    }

    private static String canonical(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("request parameters are not serializable", e);
        }
    }
}
