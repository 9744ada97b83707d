package org.example.travel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "travel")
public record TravelProperties(
        @DefaultValue Upstream upstream,
        @DefaultValue("30s") Duration timeout,
        @DefaultValue({"JP", "FR", "IT", "ES", "TH", "AU", "GB", "DE", "NZ", "CA"}) List<String> popularCodes
) {
    public record Upstream(
            @DefaultValue("https://restcountries.com/v3.1") String countriesUrl,
            @DefaultValue("https://geocoding-api.open-meteo.com") String geocodingUrl,
            @DefaultValue("https://api.open-meteo.com") String weatherUrl
    ) {}
}
