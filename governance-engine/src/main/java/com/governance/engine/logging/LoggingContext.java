package com.governance.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper so every log line of a run, step or policy decision carries its correlation ids.
 *
 * <pre>
 * try (var ctx = LoggingContext.forStep(runId, playbookId, "publish", 2)) {
 *     log.info("Invoking action");
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String PLAYBOOK_ID = "playbookId";
    public static final String STEP_NAME = "stepName";
    public static final String ATTEMPT = "attempt";
    public static final String ACTION_TYPE = "actionType";
    public static final String REQUEST_ID = "requestId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    public static LoggingContext forRun(UUID runId, String playbookId) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            MDC.put(RUN_ID, runId.toString());
        }
        if (playbookId != null) {
            MDC.put(PLAYBOOK_ID, playbookId);
        }
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forStep(UUID runId, String playbookId, String stepName, int attempt) {
        LoggingContext ctx = forRun(runId, playbookId);
        if (stepName != null) {
            MDC.put(STEP_NAME, stepName);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    public static LoggingContext forPolicy(String actionType, String requestId) {
        LoggingContext ctx = new LoggingContext();
        if (actionType != null) {
            MDC.put(ACTION_TYPE, actionType);
        }
        if (requestId != null) {
            MDC.put(REQUEST_ID, requestId);
        }
        ensureTraceId();
        return ctx;
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    /**
     * Removes everything but the trace id, which stays for the rest of the request.
     */
    @Override
    public void close() {
        MDC.remove(RUN_ID);
        MDC.remove(PLAYBOOK_ID);
        MDC.remove(STEP_NAME);
        MDC.remove(ATTEMPT);
        MDC.remove(ACTION_TYPE);
        MDC.remove(REQUEST_ID);
    }

    public static void clearAll() {
        MDC.clear();
    }
}
