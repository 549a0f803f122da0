package com.crossvenue.arb.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans an alert out to every sink without blocking the caller. A failing sink never affects
 * the others or the trading path.
 */
@Slf4j
public class AlertDispatcher implements AlertSink {

    private final List<AlertSink> sinks;
    private final Executor executor;

    public AlertDispatcher(List<AlertSink> sinks, Executor executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
    }

    @Override
    public void notify(AlertSeverity severity, String message, Map<String, Object> context) {
        Map<String, Object> ctx = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        for (AlertSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, severity, message, ctx));
            } catch (RejectedExecutionException e) {
                // executor shut down: deliver inline so a critical alert is not lost
                deliver(sink, severity, message, ctx);
            }
        }
    }

    private static void deliver(AlertSink sink, AlertSeverity severity, String message, Map<String, Object> ctx) {
        try {
            sink.notify(severity, message, ctx);
        } catch (RuntimeException e) {
            log.error("Alert sink {} failed for '{}'", sink.getClass().getSimpleName(), message, e);
        }
    }
}
