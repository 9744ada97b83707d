package org.example.travel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TravelAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TravelAggregatorApplication.class, args);
    }
}
