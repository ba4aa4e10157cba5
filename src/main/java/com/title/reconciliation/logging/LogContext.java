package com.title.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRecord(jobId, personId)) {
 *     log.info("record.completed flag={}", flag);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String JOB_ID = "jobId";
    public static final String PERSON_ID = "personId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for the lifetime of a reconciliation job.
     */
    public static LogContext forJob(String jobId) {
        LogContext ctx = new LogContext();
        ctx.put(JOB_ID, jobId);
        ctx.put(OPERATION, "job");
        return ctx;
    }

    /**
     * Context for one record processed by a worker.
     */
    public static LogContext forRecord(String jobId, String personId) {
        LogContext ctx = new LogContext();
        ctx.put(JOB_ID, jobId);
        ctx.put(PERSON_ID, personId);
        ctx.put(OPERATION, "record");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
