package org.example.travel.client.restcountries;

import lombok.extern.slf4j.Slf4j;
import org.example.travel.config.TravelProperties;
import org.example.travel.exception.DestinationNotFoundException;
import org.example.travel.exception.InvalidInputException;
import org.example.travel.exception.UpstreamUnavailableException;
import org.example.travel.model.CountryCode;
import org.example.travel.model.Destination;
import org.example.travel.model.Destinations;
import org.example.travel.model.country.RestCountryDto;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Component
public class RestCountriesClient implements CountryDirectoryClient {

    private static final String NOT_AVAILABLE = "N/A";
    private static final String UNKNOWN = "Unknown";
    private static final ParameterizedTypeReference<List<RestCountryDto>> COUNTRY_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient http;
    private final List<String> popularCodes;

    public RestCountriesClient(RestClient.Builder builder, TravelProperties props) {
        this.http = builder.baseUrl(props.upstream().countriesUrl()).build();
        this.popularCodes = List.copyOf(props.popularCodes());
    }

    @Override
    public List<Destination> listPopular() {
        try {
            var countries = http.get()
                    .uri(uri -> uri.path("/alpha")
                            .queryParam("codes", String.join(",", popularCodes))
                            .build())
                    .retrieve()
                    .body(COUNTRY_LIST);
            if (countries == null) return List.of();
            log.debug("fetched {} popular destinations", countries.size());
            return countries.stream().map(RestCountriesClient::toDestination).toList();
        } catch (RestClientException ex) {
            throw new UpstreamUnavailableException("Failed to fetch country data: " + ex.getMessage(), ex);
        }
    }

    @Override
    public Destination getByCode(String code) {
        List<RestCountryDto> countries;
        try {
            countries = http.get()
                    .uri("/alpha/{code}", code.toUpperCase(Locale.ROOT))
                    .retrieve()
                    .body(COUNTRY_LIST);
        } catch (HttpClientErrorException.NotFound ex) {
            throw new DestinationNotFoundException("Country " + code + " not found");
        } catch (RestClientException ex) {
            throw new UpstreamUnavailableException("Failed to fetch country data: " + ex.getMessage(), ex);
        }
        if (countries == null || countries.isEmpty()) {
            throw new DestinationNotFoundException("Country " + code + " not found");
        }
        return toDestination(countries.get(0));
    }

    @Override
    public CountryCode searchByName(String name) {
        // a blank query is a substring of every name and would match the first destination
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("country is required");
        }
        var destinations = listPopular();
        var popular = Destinations.findByName(destinations, name);
        if (popular.isPresent()) {
            return CountryCode.of(popular.get());
        }
        return searchUpstream(name).orElseThrow(() -> new DestinationNotFoundException(
                "Country '" + name + "' not found. Try: " + Destinations.sampleNames(destinations) + "..."));
    }

    // A failed name search counts as "no match": the caller reports not-found with a hint.
    private Optional<CountryCode> searchUpstream(String name) {
        try {
            var countries = http.get()
                    .uri("/name/{name}", name)
                    .retrieve()
                    .body(COUNTRY_LIST);
            if (countries == null || countries.isEmpty()) return Optional.empty();
            return Optional.of(CountryCode.of(toDestination(countries.get(0))));
        } catch (RestClientException ex) {
            log.warn("country name search for '{}' failed: {}", name, ex.getMessage());
            return Optional.empty();
        }
    }

    static Destination toDestination(RestCountryDto c) {
        var capital = isEmpty(c.capital()) ? NOT_AVAILABLE : c.capital().get(0);
        return new Destination(
                c.cca2() == null ? "" : c.cca2(),
                c.name() == null || c.name().common() == null ? UNKNOWN : c.name().common(),
                capital,
                c.region() == null ? UNKNOWN : c.region(),
                c.population() == null ? 0L : c.population(),
                orPlaceholder(c.currencies() == null ? null : c.currencies().keySet()),
                orPlaceholder(c.languages() == null ? null : c.languages().values())
        );
    }

    private static List<String> orPlaceholder(Collection<String> values) {
        return isEmpty(values) ? List.of(NOT_AVAILABLE) : List.copyOf(values);
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
