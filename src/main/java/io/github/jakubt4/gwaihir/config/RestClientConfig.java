package io.github.jakubt4.gwaihir.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer restClientCustomizer(final GroundStationProperties groundStation) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(groundStation.connectTimeout());
            requestFactory.setReadTimeout(groundStation.readTimeout());
            builder.requestFactory(requestFactory);
        };
    }
}
