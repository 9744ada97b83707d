package org.example.travel.controller;

import lombok.RequiredArgsConstructor;
import org.example.travel.client.restcountries.CountryDirectoryClient;
import org.example.travel.model.CountryCode;
import org.example.travel.model.Destination;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/destinations")
@RequiredArgsConstructor
public class DestinationController {
    private final CountryDirectoryClient countries;

    @GetMapping
    public List<Destination> list() {
        return countries.listPopular();
    }

    @GetMapping("/search")
    public CountryCode search(@RequestParam("country") String country) {
        return countries.searchByName(country);
    }

    @GetMapping("/{code}")
    public Destination get(@PathVariable("code") String code) {
        return countries.getByCode(code);
    }
}
