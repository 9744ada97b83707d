package org.example.travel.model.weather;

public record Coordinates(double latitude, double longitude) {}
