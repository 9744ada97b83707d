package org.example.travel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Destination(
        String countryCode,
        String countryName,
        String capital,
        String region,
        long population,
        List<String> currencies,
        List<String> languages
) {}
