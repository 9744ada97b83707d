package org.example.travel.client.openmeteo;

import org.example.travel.model.weather.Coordinates;
import org.example.travel.support.TravelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.Optional;

import static org.example.travel.support.TravelFixtures.GEOCODING_URL;
import static org.example.travel.support.TravelFixtures.json;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OpenMeteoGeocodingClientTest {

    private MockRestServiceServer server;
    private OpenMeteoGeocodingClient client;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenMeteoGeocodingClient(builder, TravelFixtures.properties());
    }

    @Test
    void resolve_returnsFirstHit() {
        server.expect(requestTo(startsWith(GEOCODING_URL + "/v1/search?")))
                .andExpect(queryParam("name", "Tokyo"))
                .andExpect(queryParam("count", "1"))
                .andExpect(queryParam("format", "json"))
                .andRespond(withSuccess(json("geocoding-tokyo.json"), MediaType.APPLICATION_JSON));

        var coords = client.resolve("Tokyo");

        server.verify();
        assertEquals(Optional.of(new Coordinates(35.6895, 139.69171)), coords);
    }

    @Test
    void resolve_noResults_isEmpty() {
        server.expect(requestTo(startsWith(GEOCODING_URL + "/v1/search?")))
                .andRespond(withSuccess(json("geocoding-empty.json"), MediaType.APPLICATION_JSON));

        assertTrue(client.resolve("Nowhere").isEmpty());
    }

    @Test
    void resolve_upstreamFailure_isSwallowedAsEmpty() {
        server.expect(requestTo(startsWith(GEOCODING_URL + "/v1/search?")))
                .andRespond(withServerError());

        assertTrue(client.resolve("Tokyo").isEmpty());
    }

    @Test
    void resolve_connectionFailure_isSwallowedAsEmpty() {
        server.expect(requestTo(startsWith(GEOCODING_URL + "/v1/search?")))
                .andRespond(withException(new IOException("timed out")));

        assertTrue(client.resolve("Tokyo").isEmpty());
    }
}
