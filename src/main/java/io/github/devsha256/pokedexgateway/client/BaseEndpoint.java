package io.github.devsha256.pokedexgateway.client;

import io.github.devsha256.pokedexgateway.exception.InvalidBaseUrlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * An absolute http(s) URL that relative resource paths can be joined onto.
 * Instances are immutable.
 */
public final class BaseEndpoint {

    private final URI uri;

    private BaseEndpoint(URI uri) {
        this.uri = uri;
    }

    /**
     * Parses and validates a base URL.
     *
     * @throws InvalidBaseUrlException if the value is not an absolute, hierarchical
     *                                 http or https URL with a host
     */
    public static BaseEndpoint parse(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InvalidBaseUrlException(String.valueOf(baseUrl), "value is empty");
        }
        URI parsed;
        try {
            parsed = new URI(baseUrl.trim());
        } catch (URISyntaxException e) {
            throw new InvalidBaseUrlException(baseUrl, e.getMessage(), e);
        }
        if (!parsed.isAbsolute()) {
            throw new InvalidBaseUrlException(baseUrl, "not an absolute URL");
        }
        if (parsed.isOpaque()) {
            throw new InvalidBaseUrlException(baseUrl, "URL cannot be used as a base");
        }
        String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidBaseUrlException(baseUrl, "scheme must be http or https");
        }
        if (parsed.getHost() == null) {
            throw new InvalidBaseUrlException(baseUrl, "URL has no host");
        }
        // lowercase scheme, and "/" for an empty path since URI.resolve drops the separator otherwise
        String rawPath = parsed.getRawPath();
        if (!scheme.equals(parsed.getScheme()) || rawPath == null || rawPath.isEmpty()) {
            StringBuilder normalized = new StringBuilder(scheme)
                    .append("://")
                    .append(parsed.getRawAuthority())
                    .append(rawPath == null || rawPath.isEmpty() ? "/" : rawPath);
            if (parsed.getRawQuery() != null) {
                normalized.append('?').append(parsed.getRawQuery());
            }
            if (parsed.getRawFragment() != null) {
                normalized.append('#').append(parsed.getRawFragment());
            }
            try {
                parsed = new URI(normalized.toString());
            } catch (URISyntaxException e) {
                throw new InvalidBaseUrlException(baseUrl, e.getMessage(), e);
            }
        }
        return new BaseEndpoint(parsed);
    }

    /**
     * Joins a relative path onto this base the way a browser resolves a relative link:
     * {@code https://host/api/v2/} + {@code pokemon} gives {@code https://host/api/v2/pokemon},
     * while {@code https://host/api/v2} + {@code pokemon} gives {@code https://host/api/pokemon}.
     */
    public URI resolve(String relativePath) {
        Objects.requireNonNull(relativePath, "relativePath");
        return uri.resolve(relativePath);
    }

    public URI uri() {
        return uri;
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
