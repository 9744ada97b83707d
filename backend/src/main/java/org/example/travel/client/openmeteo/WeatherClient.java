package org.example.travel.client.openmeteo;

import org.example.travel.model.weather.Weather;

public interface WeatherClient {

    Weather currentWeather(double lat, double lon, String locationLabel);

}
