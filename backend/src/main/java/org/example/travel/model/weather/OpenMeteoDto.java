package org.example.travel.model.weather;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenMeteoDto(
        Current current
){
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Current(
            Double  temperature_2m,
            Integer relative_humidity_2m,
            Integer weather_code,
            Double  wind_speed_10m
    ) {}
}
