package com.example.salary.config;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Puts a per-run id into the logging MDC so every line of one salary run can be correlated.
 */
public final class RunContextManager {

    public static final String RUN_ID = "runId";

    private RunContextManager() {}

    /**
     * Reuse the run id already in the MDC, or start a new one.
     */
    public static String ensureRunId() {
        String runId = MDC.get(RUN_ID);
        if (runId == null || runId.isEmpty()) {
            runId = generateRunId();
            MDC.put(RUN_ID, runId);
        }
        return runId;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
    }
}
