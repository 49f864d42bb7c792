package com.seccrawl.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 로거.
 * 로거 이름은 "{클래스}.events". 일반 로그와 분리해서 레벨을 조절할 수 있다.
 * kvs는 "key", value, ... 쌍.
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls.getName() + ".events");
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(line("DEBUG", event, null, kvs));
    }
    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(line("INFO", event, null, kvs));
    }
    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(line("WARN", event, null, kvs));
    }
    public void error(String event, Throwable t, Object... kvs) {
        if (log.isErrorEnabled()) log.error(line("ERROR", event, t, kvs), t);
    }

    /** 테스트에서 포맷 확인용 */
    static String format(String lvl, String comp, String event, Throwable t, Object... kvs) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl);
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                String k = String.valueOf(kvs[i]);
                Object v = kvs[i + 1];
                if (v == null) n.putNull(k);
                else if (v instanceof Integer x) n.put(k, x);
                else if (v instanceof Long x) n.put(k, x);
                else if (v instanceof Double x) n.put(k, x);
                else if (v instanceof Boolean x) n.put(k, x);
                else n.put(k, String.valueOf(v));
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", String.valueOf(t.getMessage()));
        }
        try {
            return MAPPER.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            return "{\"_serialization_error\":true}";
        }
    }

    private String line(String lvl, String event, Throwable t, Object... kvs) {
        return format(lvl, comp, event, t, kvs);
    }
}
