package com.webscout.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 크롤 이벤트를 JSON 한 줄로 남기는 로거.
 * 모든 이벤트는 JUL 로거 {@value #LOGGER_NAME} 하나로 남는다(컴포넌트는 "comp" 필드).
 *
 * <pre>
 * ELOG.event(CrawlEvent.PAGE_FETCHED).with("url", url).with("depth", 2).log();
 * </pre>
 */
public final class CrawlEventLog {

    public static final String LOGGER_NAME = "webscout.events";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger jul = Logger.getLogger(LOGGER_NAME);
    private final String comp;

    private CrawlEventLog(Class<?> cls) {
        this.comp = cls.getSimpleName();
    }

    public static CrawlEventLog of(Class<?> cls) {
        return new CrawlEventLog(Objects.requireNonNull(cls, "cls"));
    }

    public Entry event(CrawlEvent type) {
        return new Entry(Objects.requireNonNull(type, "type"));
    }

    /** 이벤트 하나분의 필드 누적. log() 호출 전까지는 아무것도 쓰지 않는다. */
    public final class Entry {
        private final CrawlEvent type;
        private final ObjectNode node = MAPPER.createObjectNode();
        private Throwable error;

        private Entry(CrawlEvent type) {
            this.type = type;
            node.put("ts", Instant.now().toString());
            node.put("lvl", type.level().getName());
            node.put("comp", comp);
            node.put("thread", Thread.currentThread().getName());
            node.put("event", type.wireName());
        }

        public Entry with(String key, Object value) {
            if (value == null) node.putNull(key);
            else if (value instanceof Number || value instanceof Boolean) node.set(key, MAPPER.valueToTree(value));
            else node.put(key, value.toString());
            return this;
        }

        public Entry error(Throwable t) {
            this.error = t;
            if (t != null) {
                node.put("error", t.getClass().getSimpleName());
                node.put("message", t.getMessage());
            }
            return this;
        }

        /** JSON 한 줄 */
        public String toJson() {
            return node.toString();
        }

        public void log() {
            if (!jul.isLoggable(type.level())) return;
            if (error == null) jul.log(type.level(), toJson());
            else jul.log(type.level(), toJson(), error);
        }
    }
}
