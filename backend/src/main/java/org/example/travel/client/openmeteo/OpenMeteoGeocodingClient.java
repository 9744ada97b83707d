package org.example.travel.client.openmeteo;

import lombok.extern.slf4j.Slf4j;
import org.example.travel.config.TravelProperties;
import org.example.travel.model.weather.Coordinates;
import org.example.travel.model.weather.GeocodingDto;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

@Slf4j
@Component
public class OpenMeteoGeocodingClient implements GeocodingClient {

    private final RestClient http;

    public OpenMeteoGeocodingClient(RestClient.Builder builder, TravelProperties props) {
        this.http = builder.baseUrl(props.upstream().geocodingUrl()).build();
    }

    @Override
    public Optional<Coordinates> resolve(String placeName) {
        try {
            var data = http.get()
                    .uri(uri -> uri.path("/v1/search")
                            .queryParam("name", placeName)
                            .queryParam("count", 1)
                            .queryParam("format", "json")
                            .build())
                    .retrieve()
                    .body(GeocodingDto.class);
            if (data == null || data.results() == null || data.results().isEmpty()) {
                log.debug("no geocoding hit for '{}'", placeName);
                return Optional.empty();
            }
            var hit = data.results().get(0);
            return Optional.of(new Coordinates(hit.latitude(), hit.longitude()));
        } catch (RestClientException ex) {
            log.warn("geocoding '{}' failed: {}", placeName, ex.getMessage());
            return Optional.empty();
        }
    }
}
