package org.example.travel.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class RootController {

    @GetMapping("/")
    public Map<String, Object> root() {
        var endpoints = new LinkedHashMap<String, String>();
        endpoints.put("destinations", "GET /destinations - List popular travel destinations");
        endpoints.put("destination_search", "GET /destinations/search?country={name} - Find a country code by name");
        endpoints.put("destination_info", "GET /destinations/{country_code} - Get detailed country info");
        endpoints.put("travel_summary", "POST /travel-summary - Get aggregated travel summary with weather");
        endpoints.put("travel_summary_by_name", "POST /travel-summary-by-name - Same, looked up by country name");

        var body = new LinkedHashMap<String, Object>();
        body.put("message", "Travel Data Aggregator API");
        body.put("description", "Aggregates data from multiple public APIs to provide travel information");
        body.put("data_sources", List.of(
                "REST Countries API - Country information",
                "Open-Meteo API - Weather data"
        ));
        body.put("endpoints", endpoints);
        return body;
    }
}
