package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resolved location of an IP address")
public class GeoLocation {

    @Schema(example = "US")
    private String country;

    @Schema(example = "New York")
    private String city;

    public boolean sameCountryAndCity(GeoLocation other) {
        return other != null
                && Objects.equals(country, other.country)
                && Objects.equals(city, other.city);
    }

    public String display() {
        return (city != null ? city : "unknown city") + ", " + (country != null ? country : "unknown country");
    }
}
