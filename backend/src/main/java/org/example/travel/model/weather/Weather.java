package org.example.travel.model.weather;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Weather(
        String location,
        double temperatureCelsius,
        String weatherDescription,
        int humidity,
        double windSpeedKmh
) {}
