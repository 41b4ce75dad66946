package com.security.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Security Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Behavioral anomaly detection for access and authentication events.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit a normalized event via `POST /security/events`\n" +
                                "2. Every enabled detector evaluates it against its learned profile\n" +
                                "3. Detected anomalies are stored with recommended response actions\n" +
                                "4. Analysts review them via `PUT /security/anomalies/{id}/status`\n\n" +
                                "**Detectors:**\n" +
                                "- `access_time_detector`: access outside the user's usual hours\n" +
                                "- `geo_location_detector`: new countries and impossible travel\n" +
                                "- `request_frequency_detector`: request bursts per user and per IP\n" +
                                "- `authentication_failure_detector`: brute force and password spraying\n\n" +
                                "Response actions are recommendations only; executing them is up to the caller.")
                        .contact(new Contact().name("Security Engineering")));
    }
}
