package org.example.travel.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.travel.client.openmeteo.GeocodingClient;
import org.example.travel.client.openmeteo.WeatherClient;
import org.example.travel.client.restcountries.CountryDirectoryClient;
import org.example.travel.exception.DestinationNotFoundException;
import org.example.travel.exception.InvalidInputException;
import org.example.travel.exception.UpstreamUnavailableException;
import org.example.travel.model.Destinations;
import org.example.travel.model.TravelSummary;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Builds a travel summary by calling the upstreams one after the other:
 * country lookup, geocoding of the capital, current weather. The first failing
 * step aborts the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TravelSummaryService {

    private final CountryDirectoryClient countries;
    private final GeocodingClient geocoding;
    private final WeatherClient weather;
    private final TravelAdvisor advisor;

    public TravelSummary summaryByCode(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            throw new InvalidInputException("country_code is required");
        }
        return summarize(countryCode.toUpperCase(Locale.ROOT));
    }

    /**
     * Resolves {@code countryName} against the popular destinations only; unlike
     * {@link CountryDirectoryClient#searchByName(String)} there is no upstream name search.
     */
    public TravelSummary summaryByName(String countryName) {
        if (countryName == null || countryName.isBlank()) {
            throw new InvalidInputException("country_name is required");
        }
        var query = countryName.trim();
        var destinations = countries.listPopular();
        var match = Destinations.findByName(destinations, query)
                .orElseThrow(() -> new DestinationNotFoundException(
                        "Country '" + query + "' not found in destinations. Available countries: "
                                + Destinations.sampleNames(destinations) + "..."));
        log.debug("'{}' resolved to {}", query, match.countryCode());
        return summarize(match.countryCode());
    }

    private TravelSummary summarize(String countryCode) {
        var destination = countries.getByCode(countryCode);
        var capital = destination.capital();

        var coords = geocoding.resolve(capital)
                .orElseThrow(() -> new UpstreamUnavailableException("Could not find coordinates for " + capital));
        var current = weather.currentWeather(coords.latitude(), coords.longitude(), capital);

        var tips = advisor.travelTips(destination.countryName(), destination.region(), current);
        var bestTime = advisor.bestTimeToVisit(destination.region(), countryCode);

        log.info("travel summary built: code={} capital={} temp={}°C tips={}",
                countryCode, capital, current.temperatureCelsius(), tips.size());
        return TravelSummary.of(destination, current, tips, bestTime);
    }
}
