package com.security.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation {
    private String countryCode;
    private String countryName;
    private String city;
    // Null when the resolver only knows the country
    private Double latitude;
    private Double longitude;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
