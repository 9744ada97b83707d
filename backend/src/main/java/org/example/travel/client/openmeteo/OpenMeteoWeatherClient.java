package org.example.travel.client.openmeteo;

import lombok.extern.slf4j.Slf4j;
import org.example.travel.config.TravelProperties;
import org.example.travel.exception.UpstreamUnavailableException;
import org.example.travel.model.weather.OpenMeteoDto;
import org.example.travel.model.weather.Weather;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
@Component
public class OpenMeteoWeatherClient implements WeatherClient {

    private static final String CURRENT_FIELDS =
            "temperature_2m,relative_humidity_2m,weather_code,wind_speed_10m";

    private final RestClient http;

    public OpenMeteoWeatherClient(RestClient.Builder builder, TravelProperties props) {
        this.http = builder.baseUrl(props.upstream().weatherUrl()).build();
    }

    @Override
    public Weather currentWeather(double lat, double lon, String locationLabel) {
        OpenMeteoDto data;
        try {
            data = http.get()
                    .uri(uri -> uri.path("/v1/forecast")
                            .queryParam("latitude", lat)
                            .queryParam("longitude", lon)
                            .queryParam("current", CURRENT_FIELDS)
                            .build())
                    .retrieve()
                    .body(OpenMeteoDto.class);
        } catch (RestClientException ex) {
            throw new UpstreamUnavailableException("Failed to fetch weather data: " + ex.getMessage(), ex);
        }

        var cur = data == null ? null : data.current();
        if (cur == null) {
            cur = new OpenMeteoDto.Current(null, null, null, null);
        }
        var weather = new Weather(
                locationLabel,
                orZero(cur.temperature_2m()),
                WeatherCodes.describe(cur.weather_code() == null ? 0 : cur.weather_code()),
                cur.relative_humidity_2m() == null ? 0 : cur.relative_humidity_2m(),
                orZero(cur.wind_speed_10m())
        );
        log.debug("weather for {}: {}°C, {}", locationLabel, weather.temperatureCelsius(),
                weather.weatherDescription());
        return weather;
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
