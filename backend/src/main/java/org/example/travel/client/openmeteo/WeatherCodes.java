package org.example.travel.client.openmeteo;

import java.util.Map;

import static java.util.Map.entry;

/** WMO weather interpretation codes as reported by Open-Meteo. */
public final class WeatherCodes {

    private static final String UNKNOWN = "Unknown";

    private static final Map<Integer, String> DESCRIPTIONS = Map.ofEntries(
            entry(0, "Clear sky"),
            entry(1, "Mainly clear"),
            entry(2, "Partly cloudy"),
            entry(3, "Overcast"),
            entry(45, "Foggy"),
            entry(48, "Depositing rime fog"),
            entry(51, "Light drizzle"),
            entry(53, "Moderate drizzle"),
            entry(55, "Dense drizzle"),
            entry(61, "Slight rain"),
            entry(63, "Moderate rain"),
            entry(65, "Heavy rain"),
            entry(71, "Slight snow"),
            entry(73, "Moderate snow"),
            entry(75, "Heavy snow"),
            entry(80, "Slight rain showers"),
            entry(81, "Moderate rain showers"),
            entry(82, "Violent rain showers"),
            entry(95, "Thunderstorm")
    );

    private WeatherCodes() {
    }

    public static String describe(int code) {
        return DESCRIPTIONS.getOrDefault(code, UNKNOWN);
    }
}
