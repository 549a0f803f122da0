package com.crossvenue.arb.exception;

import java.time.Duration;

public class StaleDataException extends ArbitrageException {

    public StaleDataException(String what, Duration age, Duration bound) {
        super(what + " is " + age.toMillis() + "ms old (bound " + bound.toMillis() + "ms)");
    }
}
