package org.example.travel.service;

import org.example.travel.client.openmeteo.GeocodingClient;
import org.example.travel.client.openmeteo.WeatherClient;
import org.example.travel.client.restcountries.CountryDirectoryClient;
import org.example.travel.exception.DestinationNotFoundException;
import org.example.travel.exception.InvalidInputException;
import org.example.travel.exception.UpstreamUnavailableException;
import org.example.travel.model.weather.Coordinates;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.example.travel.support.TravelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TravelSummaryServiceTest {

    @Mock
    CountryDirectoryClient countries;

    @Mock
    GeocodingClient geocoding;

    @Mock
    WeatherClient weather;

    @Spy
    TravelAdvisor advisor = new TravelAdvisor();

    @InjectMocks
    TravelSummaryService service;

    @Test
    void summaryByCode_runsPipelineInOrder_andAssemblesSummary() {
        when(countries.getByCode("JP")).thenReturn(japan());
        when(geocoding.resolve("Tokyo")).thenReturn(Optional.of(new Coordinates(35.6895, 139.69171)));
        when(weather.currentWeather(35.6895, 139.69171, "Tokyo")).thenReturn(weather("Tokyo", 5.2, "Slight rain"));

        var summary = service.summaryByCode("jp");

        InOrder order = inOrder(countries, geocoding, weather);
        order.verify(countries).getByCode("JP");
        order.verify(geocoding).resolve("Tokyo");
        order.verify(weather).currentWeather(35.6895, 139.69171, "Tokyo");

        assertEquals("JP", summary.countryCode());
        assertEquals("Japan", summary.countryName());
        assertEquals("Tokyo", summary.capital());
        assertEquals(List.of("JPY"), summary.currencies());
        assertEquals(5.2, summary.currentWeather().temperatureCelsius());
        assertEquals(List.of(
                "Bring warm layers - it's cold!",
                "Pack a good jacket and warm accessories",
                "Bring an umbrella or rain jacket",
                "Learn a few local phrases - it's appreciated!",
                "Research local customs and etiquette for Japan"
        ), summary.travelTips());
        assertEquals("March-May (cherry blossoms) or October-November (autumn colors)", summary.bestTimeToVisit());
    }

    @Test
    void summaryByCode_blank_isInvalidInput() {
        var ex = assertThrows(InvalidInputException.class, () -> service.summaryByCode(""));
        assertEquals("country_code is required", ex.getMessage());
        assertThrows(InvalidInputException.class, () -> service.summaryByCode(null));

        verifyNoInteractions(countries, geocoding, weather);
    }

    @Test
    void summaryByCode_unknownCode_isNotFound_andStopsPipeline() {
        when(countries.getByCode("ZZ")).thenThrow(new DestinationNotFoundException("Country ZZ not found"));

        assertThrows(DestinationNotFoundException.class, () -> service.summaryByCode("ZZ"));

        verifyNoInteractions(geocoding, weather);
    }

    @Test
    void summaryByCode_noCoordinates_isUpstreamUnavailable() {
        when(countries.getByCode("JP")).thenReturn(japan());
        when(geocoding.resolve("Tokyo")).thenReturn(Optional.empty());

        var ex = assertThrows(UpstreamUnavailableException.class, () -> service.summaryByCode("JP"));

        assertEquals("Could not find coordinates for Tokyo", ex.getMessage());
        verifyNoInteractions(weather);
    }

    @Test
    void summaryByCode_weatherFailure_propagates() {
        when(countries.getByCode("FR")).thenReturn(france());
        when(geocoding.resolve("Paris")).thenReturn(Optional.of(new Coordinates(48.85, 2.35)));
        when(weather.currentWeather(anyDouble(), anyDouble(), eq("Paris")))
                .thenThrow(new UpstreamUnavailableException("Failed to fetch weather data: 502 Bad Gateway"));

        var ex = assertThrows(UpstreamUnavailableException.class, () -> service.summaryByCode("FR"));

        assertEquals("Failed to fetch weather data: 502 Bad Gateway", ex.getMessage());
        verifyNoInteractions(advisor);
    }

    @Test
    void summaryByName_trimsAndMatchesPopularDestination() {
        when(countries.listPopular()).thenReturn(popular());
        when(countries.getByCode("FR")).thenReturn(france());
        when(geocoding.resolve("Paris")).thenReturn(Optional.of(new Coordinates(48.85, 2.35)));
        when(weather.currentWeather(48.85, 2.35, "Paris")).thenReturn(weather("Paris", 35, "Clear sky"));

        var summary = service.summaryByName("  france ");

        assertEquals("FR", summary.countryCode());
        assertEquals(List.of(
                "Pack light, breathable clothing - it's hot!",
                "Stay hydrated and use sunscreen",
                "Consider getting a travel adapter for EU plugs",
                "Research local customs and etiquette for France"
        ), summary.travelTips());
        assertEquals("April-June or September-October for mild weather", summary.bestTimeToVisit());
    }

    @Test
    void summaryByName_unknown_isNotFound_withoutUpstreamNameSearch() {
        when(countries.listPopular()).thenReturn(popular());

        var ex = assertThrows(DestinationNotFoundException.class, () -> service.summaryByName("Peru"));

        assertEquals("Country 'Peru' not found in destinations. Available countries: "
                + "Japan, France, Italy, Spain, Thailand...", ex.getMessage());
        verify(countries, never()).searchByName(any());
        verify(countries, never()).getByCode(any());
        verifyNoInteractions(geocoding, weather);
    }

    @Test
    void summaryByName_blank_isInvalidInput() {
        assertThrows(InvalidInputException.class, () -> service.summaryByName("   "));
        verifyNoInteractions(countries);
    }
}
