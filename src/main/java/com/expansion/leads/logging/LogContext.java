package com.expansion.leads.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped MDC entries for pipeline logging. Entries set by a context are rolled back on close:
 * a key that held a value before the context opened gets that value back, any other key is removed.
 *
 * <pre>
 * try (LogContext ignored = LogContext.forLead(lead.getKey(), "SPONSOR_REGISTER")) {
 *     log.info("lead.scored score={} bucket={}", score, bucket);
 * }
 * </pre>
 *
 * Keys appear in the logback pattern as {@code %X{runId}}, {@code %X{stage}} and so on.
 */
public final class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String LEAD_KEY = "leadKey";
    public static final String SOURCE = "source";
    public static final String STAGE = "stage";

    // value each key held before this context, null when it was unset
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        return new LogContext().with(RUN_ID, runId);
    }

    /**
     * Work on one lead or source row; {@code source} is the provenance text.
     */
    public static LogContext forLead(String leadKey, String source) {
        return new LogContext().with(LEAD_KEY, leadKey).with(SOURCE, source);
    }

    public static LogContext forStage(String stage) {
        return new LogContext().with(STAGE, stage);
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
