package com.security.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    ACCESS_TIME("access_time"),
    GEOGRAPHIC_LOCATION("geographic_location"),
    REQUEST_FREQUENCY("request_frequency"),
    REQUEST_PATTERN("request_pattern"),
    AUTHENTICATION_FAILURE("authentication_failure"),
    AUTHORIZATION_BYPASS("authorization_bypass"),
    DATA_ACCESS("data_access"),
    API_USAGE("api_usage"),
    USER_BEHAVIOR("user_behavior"),
    CUSTOM("custom");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnomalyType fromValue(String value) {
        if (value != null) {
            for (AnomalyType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Invalid anomaly type: " + value);
    }
}
