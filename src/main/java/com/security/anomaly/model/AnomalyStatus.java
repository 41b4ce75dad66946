package com.security.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyStatus {
    NEW("new"),
    UNDER_REVIEW("under_review"),
    RESOLVED("resolved"),
    FALSE_POSITIVE("false_positive");

    private final String value;

    AnomalyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnomalyStatus fromValue(String value) {
        if (value != null) {
            for (AnomalyStatus status : values()) {
                if (status.value.equals(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException(
                "Invalid status: " + value + ". Must be one of new, under_review, resolved, false_positive");
    }
}
