package org.example.travel.model.weather;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GeocodingDto(
        List<Result> results
){
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
            String name,
            double latitude,
            double longitude,
            String country_code
    ) {}
}
