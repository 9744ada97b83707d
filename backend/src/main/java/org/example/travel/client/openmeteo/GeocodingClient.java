package org.example.travel.client.openmeteo;

import org.example.travel.model.weather.Coordinates;

import java.util.Optional;

public interface GeocodingClient {

    /** Top search hit for {@code placeName}; empty when nothing matches or the lookup fails. */
    Optional<Coordinates> resolve(String placeName);

}
