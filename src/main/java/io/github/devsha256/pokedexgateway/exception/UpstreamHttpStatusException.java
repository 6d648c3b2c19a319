package io.github.devsha256.pokedexgateway.exception;

/**
 * The upstream API answered with a status outside 200-299.
 */
public class UpstreamHttpStatusException extends UpstreamException {

    private final int status;

    public UpstreamHttpStatusException(String url, int status, String reason) {
        super("Request to " + url + " failed with HTTP " + status + (reason == null || reason.isBlank() ? "" : " " + reason));
        this.status = status;
    }

    public int getStatus() { return status; }
}
