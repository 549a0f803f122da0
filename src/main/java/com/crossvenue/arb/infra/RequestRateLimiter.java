package com.crossvenue.arb.infra;

/**
 * Blocks the caller until an outbound request is allowed.
 */
public interface RequestRateLimiter {

    void acquire();

    static RequestRateLimiter noop() {
        return () -> {
        };
    }

    static RequestRateLimiter perSecond(double permitsPerSecond) {
        if (permitsPerSecond <= 0) {
            return noop();
        }
        return new TokenBucketRateLimiter(permitsPerSecond, Math.max(1.0, permitsPerSecond));
    }
}
