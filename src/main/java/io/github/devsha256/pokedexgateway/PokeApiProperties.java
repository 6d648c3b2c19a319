package io.github.devsha256.pokedexgateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Maps the upstream PokeAPI configuration from application.properties to a Java object.
 * Properties are prefixed with 'pokeapi' and can be overridden from the environment
 * (e.g. {@code POKEAPI_BASE_URL}).
 */
@Configuration
@ConfigurationProperties(prefix = "pokeapi")
public class PokeApiProperties {

    public static final String DEFAULT_BASE_URL = "https://pokeapi.co/api/v2/";
    public static final String DEFAULT_LIST_RESOURCE = "pokemon";

    // Must be an absolute http(s) URL; a trailing slash keeps its last path segment on join
    private String baseUrl = DEFAULT_BASE_URL;

    // Relative path of the paginated list resource, joined onto baseUrl
    private String listResource = DEFAULT_LIST_RESOURCE;

    // Optional; when unset the HTTP client defaults apply
    private Duration connectTimeout;

    private Duration readTimeout;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getListResource() { return listResource; }
    public void setListResource(String listResource) { this.listResource = listResource; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
}
