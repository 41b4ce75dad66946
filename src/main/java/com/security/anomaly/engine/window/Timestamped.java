package com.security.anomaly.engine.window;

public interface Timestamped {

    long timestampMillis();
}
