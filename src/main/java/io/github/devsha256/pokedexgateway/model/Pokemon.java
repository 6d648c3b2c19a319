package io.github.devsha256.pokedexgateway.model;

/**
 * A list entry as returned to our callers. {@code id} is an unsigned 32-bit value.
 */
public record Pokemon(long id, String name) { }
