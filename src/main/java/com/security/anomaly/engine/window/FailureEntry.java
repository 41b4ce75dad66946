package com.security.anomaly.engine.window;

/**
 * One failed authentication attempt. The counterpart is the other side of the
 * attempt: the source IP in user and endpoint lists, the user id in IP lists.
 */
public record FailureEntry(long timestampMillis, String counterpart) implements Timestamped {
}
