package org.example.travel.client.restcountries;

import org.example.travel.model.CountryCode;
import org.example.travel.model.Destination;

import java.util.List;

public interface CountryDirectoryClient {

    List<Destination> listPopular();

    Destination getByCode(String code);

    CountryCode searchByName(String name);

}
