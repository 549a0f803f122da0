package com.crossvenue.arb.infra;

import com.crossvenue.arb.exception.RateLimitedException;
import com.crossvenue.arb.exception.TransientVenueException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential backoff for venue calls.
 * <ul>
 *   <li>{@link TransientVenueException}: retried up to {@code maxAttempts} with doubling backoff, capped.</li>
 *   <li>{@link RateLimitedException}: waits the venue's hint and does not consume an attempt,
 *       up to {@code maxRateLimitWaits} times.</li>
 *   <li>Anything else propagates immediately.</li>
 * </ul>
 */
@Slf4j
public class RetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final int maxRateLimitWaits;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, int maxRateLimitWaits) {
        this(maxAttempts, initialBackoff, maxBackoff, maxRateLimitWaits, THREAD_SLEEPER);
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff,
                       int maxRateLimitWaits, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
        this.maxRateLimitWaits = Math.max(0, maxRateLimitWaits);
        this.sleeper = sleeper;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 0;
        int rateLimitWaits = 0;
        Duration backoff = initialBackoff;

        while (true) {
            try {
                return call.get();
            } catch (RateLimitedException e) {
                if (++rateLimitWaits > maxRateLimitWaits) {
                    throw e;
                }
                log.warn("{} rate limited by {}, waiting {}ms ({}/{})", operation, e.getVenueId(),
                        e.getRetryAfter().toMillis(), rateLimitWaits, maxRateLimitWaits);
                pause(e.getRetryAfter(), e);
            } catch (TransientVenueException e) {
                if (++attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed ({}), retry {}/{} in {}ms", operation, e.getMessage(), attempt,
                        maxAttempts - 1, backoff.toMillis());
                pause(backoff, e);
                backoff = next(backoff);
            }
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    Duration backoffAfter(int failures) {
        Duration d = initialBackoff;
        for (int i = 1; i < failures; i++) {
            d = next(d);
        }
        return d;
    }

    private Duration next(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
    }

    private void pause(Duration duration, RuntimeException cause) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
