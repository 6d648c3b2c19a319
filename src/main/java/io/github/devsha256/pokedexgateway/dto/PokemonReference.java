package io.github.devsha256.pokedexgateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Upstream list entry: the detail resource URL and the display name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PokemonReference(String url, String name) {

    public PokemonReference {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(name, "name");
    }
}
