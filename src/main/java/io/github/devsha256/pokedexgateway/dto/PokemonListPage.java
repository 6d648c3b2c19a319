package io.github.devsha256.pokedexgateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * One page of the upstream list resource:
 * {@code {"count": 1302, "next": "...", "previous": null, "results": [...]}}.
 * {@code next} and {@code previous} may be missing or null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PokemonListPage(
        Long count,
        String next,
        String previous,
        List<PokemonReference> results
) {
    static final long MAX_COUNT = 0xFFFF_FFFFL;

    public PokemonListPage {
        Objects.requireNonNull(count, "count");
        Objects.requireNonNull(results, "results");
        if (count < 0 || count > MAX_COUNT) {
            throw new IllegalArgumentException("count out of unsigned 32-bit range: " + count);
        }
        results = List.copyOf(results);
    }
}
