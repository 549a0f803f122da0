package com.crossvenue.arb.infra;

import java.util.concurrent.TimeUnit;

public class TokenBucketRateLimiter implements RequestRateLimiter {

    private final double permitsPerSecond;
    private final double burst;
    private long lastSync = System.nanoTime();
    private double storedPermits;

    public TokenBucketRateLimiter(double permitsPerSecond, double burst) {
        if (permitsPerSecond <= 0 || burst < 1.0) {
            throw new IllegalArgumentException("permitsPerSecond must be > 0 and burst >= 1");
        }
        this.permitsPerSecond = permitsPerSecond;
        this.burst = burst;
        this.storedPermits = burst;
    }

    @Override
    public synchronized void acquire() {
        refill();
        if (storedPermits >= 1.0) {
            storedPermits -= 1.0;
            return;
        }

        double missing = 1.0 - storedPermits;
        long waitNanos = (long) (missing / permitsPerSecond * 1_000_000_000.0);
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        lastSync = System.nanoTime();
        storedPermits = 0;
    }

    private void refill() {
        long now = System.nanoTime();
        double newPermits = (now - lastSync) / 1_000_000_000.0 * permitsPerSecond;
        storedPermits = Math.min(burst, storedPermits + newPermits);
        lastSync = now;
    }
}
