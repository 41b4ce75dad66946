package com.security.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mitigation recommended for an external responder. The engine never executes these.
 */
public enum ResponseAction {
    LOG_ONLY("log_only"),
    NOTIFY_ADMIN("notify_admin"),
    RATE_LIMIT("rate_limit"),
    REQUIRE_MFA("require_mfa"),
    LOCK_ACCOUNT("lock_account"),
    REVOKE_SESSION("revoke_session"),
    BLOCK_IP("block_ip");

    private final String value;

    ResponseAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResponseAction fromValue(String value) {
        for (ResponseAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Invalid response action: " + value);
    }
}
