package org.example.travel.service;

import org.example.travel.model.weather.Weather;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Static travel advice: packing tips from the current weather and region, and the
 * best season to visit a country. No I/O.
 */
@Component
public class TravelAdvisor {

    private static final double HOT_ABOVE_C = 30;
    private static final double COLD_BELOW_C = 10;

    private static final Map<String, String> REGION_TIPS = Map.of(
            "Europe", "Consider getting a travel adapter for EU plugs",
            "Asia", "Learn a few local phrases - it's appreciated!",
            "Oceania", "Don't forget reef-safe sunscreen for beach visits",
            "Americas", "Check visa requirements before traveling",
            "Africa", "Consult a travel health clinic for vaccinations"
    );

    private static final Map<String, String> BEST_TIMES = Map.ofEntries(
            entry("JP", "March-May (cherry blossoms) or October-November (autumn colors)"),
            entry("FR", "April-June or September-October for mild weather"),
            entry("IT", "April-June or September-October to avoid crowds"),
            entry("ES", "March-May or September-November for pleasant weather"),
            entry("TH", "November-February (cool and dry season)"),
            entry("AU", "September-November (spring) or March-May (autumn)"),
            entry("GB", "May-September for warmer weather"),
            entry("DE", "May-September for outdoor activities"),
            entry("NZ", "December-February (summer) for best weather"),
            entry("CA", "June-August for summer, December-March for skiing")
    );

    /** Tips in a fixed order: temperature, precipitation, region, customs. */
    public List<String> travelTips(String countryName, String region, Weather weather) {
        var tips = new ArrayList<String>();

        double temp = weather.temperatureCelsius();
        if (temp > HOT_ABOVE_C) {
            tips.add("Pack light, breathable clothing - it's hot!");
            tips.add("Stay hydrated and use sunscreen");
        } else if (temp < COLD_BELOW_C) {
            tips.add("Bring warm layers - it's cold!");
            tips.add("Pack a good jacket and warm accessories");
        } else {
            tips.add("Weather is mild - pack versatile clothing");
        }

        var description = weather.weatherDescription() == null
                ? ""
                : weather.weatherDescription().toLowerCase(Locale.ROOT);
        if (description.contains("rain") || description.contains("drizzle")) {
            tips.add("Bring an umbrella or rain jacket");
        }

        if (region != null && REGION_TIPS.containsKey(region)) {
            tips.add(REGION_TIPS.get(region));
        }

        tips.add("Research local customs and etiquette for " + countryName);
        return List.copyOf(tips);
    }

    public String bestTimeToVisit(String region, String countryCode) {
        if (countryCode != null && BEST_TIMES.containsKey(countryCode)) {
            return BEST_TIMES.get(countryCode);
        }
        return "Research the best season for " + region;
    }
}
