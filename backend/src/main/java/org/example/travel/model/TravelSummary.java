package org.example.travel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.example.travel.model.weather.Weather;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TravelSummary(
        String countryCode,
        String countryName,
        String capital,
        String region,
        long population,
        List<String> currencies,
        List<String> languages,
        Weather currentWeather,
        List<String> travelTips,
        String bestTimeToVisit
) {
    public static TravelSummary of(Destination d, Weather weather, List<String> tips, String bestTime) {
        return new TravelSummary(
                d.countryCode(),
                d.countryName(),
                d.capital(),
                d.region(),
                d.population(),
                d.currencies(),
                d.languages(),
                weather,
                tips,
                bestTime
        );
    }
}
