package io.github.devsha256.pokedexgateway.exception;

/**
 * Raised at startup when the configured upstream base URL cannot be used.
 */
public class InvalidBaseUrlException extends RuntimeException {

    public InvalidBaseUrlException(String baseUrl, String message) {
        super("Invalid base url '" + baseUrl + "': " + message);
    }

    public InvalidBaseUrlException(String baseUrl, String message, Throwable cause) {
        super("Invalid base url '" + baseUrl + "': " + message, cause);
    }
}
