package com.security.anomaly.engine.window;

/**
 * Requests counted at (roughly) one instant. Consecutive requests inside the
 * merge interval share a bucket.
 */
public record CounterBucket(long timestampMillis, int count) implements Timestamped {

    public CounterBucket increment() {
        return new CounterBucket(timestampMillis, count + 1);
    }
}
