package com.crossvenue.arb.exception;

/**
 * Invalid caps or thresholds. Fatal at startup.
 */
public class ConfigurationException extends ArbitrageException {

    public ConfigurationException(String message) {
        super(message);
    }
}
