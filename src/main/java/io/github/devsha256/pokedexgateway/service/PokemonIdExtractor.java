package io.github.devsha256.pokedexgateway.service;

import io.github.devsha256.pokedexgateway.dto.PokemonReference;
import io.github.devsha256.pokedexgateway.model.Pokemon;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Turns an upstream list entry into a {@link Pokemon} by reading the numeric id from the
 * last path segment of its detail URL, e.g. {@code https://pokeapi.co/api/v2/pokemon/25/} gives 25.
 * <p>
 * A single trailing slash is ignored. Segments are read from the raw (percent-encoded) path.
 */
@Component
public class PokemonIdExtractor {

    public Pokemon extract(PokemonReference reference) {
        String url = reference.url();
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ExtractionException(Reason.MALFORMED_URL, url, e);
        }
        if (!uri.isAbsolute()) {
            throw new ExtractionException(Reason.MALFORMED_URL, url, null);
        }
        if (uri.isOpaque() || uri.getRawPath() == null) {
            throw new ExtractionException(Reason.NO_PATH_SEGMENTS, url, null);
        }

        String lastSegment = lastSegment(uri.getRawPath());
        if (lastSegment == null) {
            throw new ExtractionException(Reason.EMPTY_SEGMENTS, url, null);
        }

        long id;
        try {
            id = Integer.toUnsignedLong(Integer.parseUnsignedInt(lastSegment));
        } catch (NumberFormatException e) {
            throw new ExtractionException(Reason.NON_NUMERIC_ID, url, e);
        }
        return new Pokemon(id, reference.name());
    }

    /**
     * Returns the last segment of the path, or null when the path has none ("" or "/").
     */
    private static String lastSegment(String rawPath) {
        String path = rawPath.startsWith("/") ? rawPath.substring(1) : rawPath;
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.isEmpty() && !rawPath.startsWith("//")) {
            return null;
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public enum Reason {
        MALFORMED_URL("not an absolute URL"),
        NO_PATH_SEGMENTS("URL has no hierarchical path"),
        EMPTY_SEGMENTS("URL path has no segments"),
        NON_NUMERIC_ID("last path segment is not an unsigned integer");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() { return description; }
    }

    /**
     * A list entry whose URL does not carry a numeric id.
     */
    public static class ExtractionException extends RuntimeException {

        private final Reason reason;
        private final String url;

        public ExtractionException(Reason reason, String url, Throwable cause) {
            super("Invalid url in pokemon response '" + url + "': " + reason.description(), cause);
            this.reason = reason;
            this.url = url;
        }

        public Reason getReason() { return reason; }

        public String getUrl() { return url; }
    }
}
