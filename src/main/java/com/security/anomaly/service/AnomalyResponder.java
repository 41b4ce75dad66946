package com.security.anomaly.service;

import com.security.anomaly.model.AnomalyEvent;

/**
 * Receives every stored anomaly when responses are enabled. Implementations
 * decide whether to act on the recommended response actions.
 */
public interface AnomalyResponder {

    void respond(AnomalyEvent anomaly);
}
