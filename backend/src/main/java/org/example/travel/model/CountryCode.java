package org.example.travel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CountryCode(String countryCode, String countryName) {

    public static CountryCode of(Destination destination) {
        return new CountryCode(destination.countryCode(), destination.countryName());
    }
}
