package org.example.travel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TravelRequest(@JsonProperty("country_code") String countryCode) {}
