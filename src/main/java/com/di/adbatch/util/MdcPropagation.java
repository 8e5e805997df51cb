package com.di.adbatch.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries SLF4J MDC ({@code sessionId}, {@code worker}) across thread hops so that log
 * lines written by campaign workers and remote-call threads stay correlated with
 * their run.
 * <p>
 * MDC is thread-local; without propagation, logs from an {@code ExecutorService} lose
 * the run's session id.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before submitting: {@code executor.submit(MdcPropagation.wrapCallable(() -> delegate.configure(request)));}</li>
 *   <li>Run with an explicit context: {@code MdcPropagation.callWithMdcContext(ctx, () -> runWorker(share));}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String SESSION_ID = "sessionId";
    public static final String WORKER     = "worker";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Callable that sets it for the
     * duration of the task on whichever thread runs it, clearing it in {@code finally}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs the callable with the given context set in MDC for the duration.
     *
     * @param contextMap MDC key-value map, e.g. {@link #copyMdc()} plus a {@code worker} entry
     * @param task       task to run
     * @return the result of the callable
     * @throws Exception if the callable throws
     */
    public static <T> T callWithMdcContext(Map<String, String> contextMap, Callable<T> task) throws Exception {
        setMdc(contextMap);
        try {
            return task.call();
        } finally {
            clearMdc(contextMap);
        }
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     *
     * @return copy of MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
