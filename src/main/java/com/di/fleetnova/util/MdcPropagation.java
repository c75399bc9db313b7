package com.di.fleetnova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Carries SLF4J MDC (e.g. the {@code run} partition) from the dispatching thread to
 * pool workers, optionally adding task-specific keys such as the {@code vessel} id.
 * <p>
 * MDC is thread-local; without propagation, logs written by worker threads lose
 * the run correlation.
 * <p>
 * Usage: {@code CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier("vessel", imo, () -> work(imo)), pool)}
 */
public final class MdcPropagation {

    public static final String RUN_KEY    = "run";
    public static final String VESSEL_KEY = "vessel";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Supplier that, when invoked on
     * another thread, sets that MDC plus {@code key=value} for the duration of the
     * task and clears it in {@code finally}.
     */
    public static <T> Supplier<T> wrapSupplier(String key, String value, Supplier<T> task) {
        Map<String, String> contextMap = new HashMap<>(copyMdc());
        if (key != null && value != null) {
            contextMap.put(key, value);
        }
        return () -> {
            setMdc(contextMap);
            try {
                return task.get();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs {@code task} on the current thread with {@code key=value} in MDC,
     * removing the key afterwards.
     */
    public static void runWith(String key, String value, Runnable task) {
        MDC.put(key, value);
        try {
            task.run();
        } finally {
            MDC.remove(key);
        }
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
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
