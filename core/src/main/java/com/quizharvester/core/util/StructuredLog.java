package com.quizharvester.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 이벤트 로그: 한 줄에 JSON 객체 하나(ts, lvl, comp, thread, event + key/value).
 * JUL로 내보내므로 app-cli의 LogSetup 핸들러(콘솔/롤링 파일)를 그대로 탄다.
 * 사람이 읽는 로그는 SLF4J, 집계/추적용 이벤트는 여기.
 */
public final class StructuredLog {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { emit(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { emit(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { emit(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { emit(Level.SEVERE, event, t, kvs); }

    private void emit(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, comp, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    static String toJson(Level lvl, String comp, String event, Throwable t, Object... kvs) {
        ObjectNode node = JSON.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl.getName());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(node, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            // 짝이 안 맞는 마지막 키는 버리고 표시만
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", t.getMessage());
        }
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // 트리 노드 직렬화는 실패하지 않는다
            throw new IllegalStateException(e);
        }
    }

    private static void put(ObjectNode node, String key, Object v) {
        if (v == null) node.putNull(key);
        else if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte)
            node.put(key, ((Number) v).longValue());
        else if (v instanceof Number n) node.put(key, n.doubleValue());
        else if (v instanceof Boolean b) node.put(key, b);
        else node.put(key, String.valueOf(v));
    }
}
