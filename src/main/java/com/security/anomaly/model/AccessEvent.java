package com.security.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A normalized access or authentication event fed to the detectors")
public class AccessEvent {

    @Schema(description = "Event time, ISO-8601. Values without an offset are read as UTC.",
            example = "2026-03-14T09:30:00Z")
    private String timestamp;

    @Schema(description = "Authenticated user, if any", example = "user-42")
    private String userId;

    @Schema(description = "Client IP address", example = "203.0.113.7")
    private String ipAddress;

    @Schema(description = "Requested endpoint path", example = "/api/v1/login")
    private String endpoint;

    @Schema(description = "HTTP method", example = "POST")
    private String method;

    @Schema(description = "Client user agent", example = "Mozilla/5.0")
    private String userAgent;

    @Schema(description = "HTTP response code", example = "401")
    private Integer responseCode;

    @Schema(description = "Request correlation id", example = "req-0001")
    private String requestId;

    @Schema(description = "Outcome of an authentication attempt. Absent for non-authentication events.",
            example = "false")
    private Boolean authenticationSuccess;
}
