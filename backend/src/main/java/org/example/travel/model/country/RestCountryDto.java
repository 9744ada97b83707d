package org.example.travel.model.country;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/** One record of the REST Countries v3.1 API, reduced to the fields we read. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RestCountryDto(
        String cca2,
        Name name,
        List<String> capital,
        String region,
        Long population,
        Map<String, Currency> currencies,
        Map<String, String> languages
){
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Name(String common, String official) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Currency(String name, String symbol) {}
}
