package com.crossvenue.arb.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class LoggingAlertSink implements AlertSink {

    @Override
    public void notify(AlertSeverity severity, String message, Map<String, Object> context) {
        switch (severity) {
            case CRITICAL -> log.error("[ALERT] {} {}", message, context);
            case WARNING -> log.warn("[ALERT] {} {}", message, context);
            case INFO -> log.info("[ALERT] {} {}", message, context);
        }
    }
}
