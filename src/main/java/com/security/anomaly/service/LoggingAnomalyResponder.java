package com.security.anomaly.service;

import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalySeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default responder: records the recommendation, executes nothing.
 */
@Component
public class LoggingAnomalyResponder implements AnomalyResponder {

    private static final Logger log = LoggerFactory.getLogger(LoggingAnomalyResponder.class);

    @Override
    public void respond(AnomalyEvent anomaly) {
        if (anomaly.getSeverity().rank() >= AnomalySeverity.HIGH.rank()) {
            log.warn("{} anomaly {} ({}) user={} ip={} recommended actions {}",
                    anomaly.getSeverity().getValue(), anomaly.getAnomalyId(), anomaly.getAnomalyType().getValue(),
                    anomaly.getUserId(), anomaly.getSourceIp(), anomaly.getResponseActions());
        } else {
            log.info("{} anomaly {} ({}) user={} ip={} recommended actions {}",
                    anomaly.getSeverity().getValue(), anomaly.getAnomalyId(), anomaly.getAnomalyType().getValue(),
                    anomaly.getUserId(), anomaly.getSourceIp(), anomaly.getResponseActions());
        }
    }
}
