package com.webgraph.core.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 이벤트 로거 (java.util.logging 위에 얹는다).
 * 예: {"ts":"...","lvl":"INFO","comp":"WebCrawler","event":"seed-done","seed":"https://a.com/","nodes":5}
 *
 * withField()로 고정 필드(예: runId)를 붙인 파생 로거를 만들 수 있다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Map<String, Object> fixed;

    private StructuredLog(Logger jul, String comp, Map<String, Object> fixed) {
        this.jul = jul;
        this.comp = comp;
        this.fixed = fixed;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), Map.of());
    }

    /** 모든 이벤트에 key=value 를 추가로 찍는 파생 로거 */
    public StructuredLog withField(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(fixed);
        m.put(key, value);
        return new StructuredLog(jul, comp, Map.copyOf(m));
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void warn (String event, Throwable t, Object... kvs) { log(Level.WARNING, event, t, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE,  event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        // 스택은 WARNING 이하에서는 생략 (메시지/타입만 JSON에 포함)
        if (t != null && lvl.intValue() >= Level.SEVERE.intValue()) jul.log(lvl, line, t);
        else jul.log(lvl, line);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160).append('{');
        field(sb, "ts", Instant.now().toString());
        field(sb, "lvl", lvl.getName());
        field(sb, "comp", comp);
        field(sb, "thread", Thread.currentThread().getName());
        field(sb, "event", event);
        for (Map.Entry<String, Object> e : fixed.entrySet()) field(sb, e.getKey(), e.getValue());

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) field(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            if (kvs.length % 2 == 1) field(sb, "_kv_mismatch", true);
        }
        if (t != null) {
            field(sb, "error", t.getClass().getSimpleName());
            field(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }

    private static void field(StringBuilder sb, String k, Object v) {
        quote(sb, k).append(':');
        if (v == null) sb.append("null");
        else if (v instanceof Number || v instanceof Boolean) sb.append(v);
        else quote(sb, String.valueOf(v));
        sb.append(',');
    }

    private static StringBuilder quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n");  break;
                case '\r': sb.append("\\r");  break;
                case '\t': sb.append("\\t");  break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        return sb.append('"');
    }
}
