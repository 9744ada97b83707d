package org.example.travel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TravelByNameRequest(@JsonProperty("country_name") String countryName) {}
