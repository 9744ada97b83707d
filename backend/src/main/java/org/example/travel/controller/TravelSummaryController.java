package org.example.travel.controller;

import lombok.RequiredArgsConstructor;
import org.example.travel.model.TravelByNameRequest;
import org.example.travel.model.TravelRequest;
import org.example.travel.model.TravelSummary;
import org.example.travel.service.TravelSummaryService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
public class TravelSummaryController {
    private final TravelSummaryService service;

    @PostMapping("/travel-summary")
    public TravelSummary byCode(@RequestBody TravelRequest request) {
        return service.summaryByCode(request.countryCode());
    }

    @PostMapping("/travel-summary-by-name")
    public TravelSummary byName(@RequestBody TravelByNameRequest request) {
        return service.summaryByName(request.countryName());
    }
}
