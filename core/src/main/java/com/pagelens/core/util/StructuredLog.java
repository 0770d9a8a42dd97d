package com.pagelens.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거(JUL 출력).
 * 이벤트명 + key/value 쌍을 한 줄 JSON으로 직렬화한다.
 * 예: log.info("extract.done", "url", url, "links", 12)
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 테스트에서도 포맷 확인용으로 사용 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl.getName());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(node, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", t.getMessage());
        }
        return node.toString();
    }

    private static void put(ObjectNode node, String k, Object v) {
        if (v == null) node.putNull(k);
        else if (v instanceof Integer i) node.put(k, i);
        else if (v instanceof Long l) node.put(k, l);
        else if (v instanceof Number n) node.put(k, n.doubleValue());
        else if (v instanceof Boolean b) node.put(k, b);
        else node.put(k, String.valueOf(v));
    }
}
