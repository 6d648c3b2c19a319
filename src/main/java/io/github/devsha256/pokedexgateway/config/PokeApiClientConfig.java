package io.github.devsha256.pokedexgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.devsha256.pokedexgateway.PokeApiProperties;
import io.github.devsha256.pokedexgateway.client.BaseEndpoint;
import io.github.devsha256.pokedexgateway.client.PokeApiClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the shared HTTP client and the upstream client.
 * An invalid {@code pokeapi.base-url} fails here and stops the application from starting.
 */
@Configuration
public class PokeApiClientConfig {

    private static final Logger log = LoggerFactory.getLogger(PokeApiClientConfig.class);

    @Bean(destroyMethod = "close")
    public CloseableHttpClient pokeApiHttpClient(PokeApiProperties properties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(toMillis(properties.getConnectTimeout()))
                .setSocketTimeout(toMillis(properties.getReadTimeout()))
                .build();
        return HttpClients.custom()
                .useSystemProperties()
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Bean
    public PokeApiClient pokeApiClient(PokeApiProperties properties,
                                       CloseableHttpClient pokeApiHttpClient,
                                       ObjectMapper objectMapper) {
        BaseEndpoint base = BaseEndpoint.parse(properties.getBaseUrl());
        log.info("Using upstream {} with list resource '{}'", base, properties.getListResource());
        return new PokeApiClient(base, properties.getListResource(), pokeApiHttpClient, objectMapper);
    }

    // -1 leaves the timeout to the client defaults
    private static int toMillis(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return -1;
        }
        return (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    }
}
