package io.github.devsha256.pokedexgateway.exception;

/**
 * DNS, connect, timeout or other I/O failure talking to the upstream API.
 */
public class UpstreamTransportException extends UpstreamException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
