package org.example.travel.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Slf4j
@Configuration
@EnableConfigurationProperties(TravelProperties.class)
public class HttpClientConfig {

    // One timeout for connect and read; an expired timeout is just another upstream failure.
    @Bean
    RestClientCustomizer upstreamTimeouts(TravelProperties props) {
        log.info("upstream timeout set to {}", props.timeout());
        return builder -> {
            var factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(props.timeout());
            factory.setReadTimeout(props.timeout());
            builder.requestFactory(factory);
        };
    }
}
