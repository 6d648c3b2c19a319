package io.github.devsha256.pokedexgateway.exception;

/**
 * The upstream API answered successfully but the body is not a valid list page.
 */
public class UpstreamDecodeException extends UpstreamException {

    public UpstreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
