package io.github.devsha256.pokedexgateway.exception;

/**
 * Base type for failures while fetching a page from the upstream API.
 * Every subtype maps to the same generic server error at the HTTP boundary.
 */
public abstract class UpstreamException extends RuntimeException {

    protected UpstreamException(String message) {
        super(message);
    }

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
