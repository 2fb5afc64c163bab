package com.previewenv.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures all logs emitted while handling an action carry its identifiers.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAction(environmentId, "CREATE", null)) {
 *     log.info("Provisioning"); // includes environmentId, action, traceId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.p.e.c.ServiceDeployer - Deployed web-app
 *   env=pr-42 action=CREATE service=web-app trace=3f9a1c2e
 */
public final class LoggingContext implements AutoCloseable {

    public static final String ENVIRONMENT_ID = "environmentId";
    public static final String SERVICE_ID = "serviceId";
    public static final String ACTION = "action";
    public static final String REASON = "reason";
    public static final String TRACE_ID = "traceId";

    private final boolean ownsTraceId;

    private LoggingContext(boolean ownsTraceId) {
        this.ownsTraceId = ownsTraceId;
    }

    /**
     * Context for one lifecycle action.
     */
    public static LoggingContext forAction(String environmentId, String action, String reason) {
        boolean ownsTraceId = ensureTraceId();
        putIfPresent(ENVIRONMENT_ID, environmentId);
        putIfPresent(ACTION, action);
        putIfPresent(REASON, reason);
        return new LoggingContext(ownsTraceId);
    }

    /**
     * Context for a sweep pass. Each dispatched action adds its own keys.
     */
    public static LoggingContext forSweep() {
        return new LoggingContext(ensureTraceId());
    }

    /**
     * Scope serviceId for the duration of one service's deploy or teardown.
     */
    public static ServiceScope forService(String serviceId) {
        putIfPresent(SERVICE_ID, serviceId);
        return new ServiceScope();
    }

    public static String getEnvironmentId() {
        return MDC.get(ENVIRONMENT_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static boolean ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            return true;
        }
        return false;
    }

    @Override
    public void close() {
        MDC.remove(ENVIRONMENT_ID);
        MDC.remove(SERVICE_ID);
        MDC.remove(ACTION);
        MDC.remove(REASON);
        if (ownsTraceId) {
            MDC.remove(TRACE_ID);
        }
    }

    /**
     * Removes only serviceId on close.
     */
    public static final class ServiceScope implements AutoCloseable {
        private ServiceScope() {
        }

        @Override
        public void close() {
            MDC.remove(SERVICE_ID);
        }
    }
}
