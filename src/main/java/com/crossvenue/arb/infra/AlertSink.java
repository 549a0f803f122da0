package com.crossvenue.arb.infra;

import java.util.Map;

/**
 * Operator notification channel. Used for naked exposure and kill-switch events.
 */
public interface AlertSink {

    void notify(AlertSeverity severity, String message, Map<String, Object> context);
}
