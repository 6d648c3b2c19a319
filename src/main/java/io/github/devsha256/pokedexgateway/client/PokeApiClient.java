package io.github.devsha256.pokedexgateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.github.devsha256.pokedexgateway.dto.PokemonListPage;
import io.github.devsha256.pokedexgateway.exception.UpstreamDecodeException;
import io.github.devsha256.pokedexgateway.exception.UpstreamHttpStatusException;
import io.github.devsha256.pokedexgateway.exception.UpstreamTransportException;
import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Client for the paginated list resource of the PokeAPI (or any API of the same shape).
 * <p>
 * One GET per call, no retries. Thread-safe: it holds only the immutable list URL,
 * the shared HTTP client and its own mapper.
 * <p>
 * Decoding is strict about scalar types: {@code "count": "12"}, {@code "count": 1.5} or
 * {@code "name": 123} are rejected instead of being coerced.
 */
public class PokeApiClient {

    private static final Logger log = LoggerFactory.getLogger(PokeApiClient.class);

    private final URI listLocation;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper mapper;

    public PokeApiClient(BaseEndpoint base, String listResource, CloseableHttpClient httpClient, ObjectMapper mapper) {
        this.listLocation = Objects.requireNonNull(base, "base").resolve(Objects.requireNonNull(listResource, "listResource"));
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = strictCopy(Objects.requireNonNull(mapper, "mapper"));
    }

    static ObjectMapper strictCopy(ObjectMapper mapper) {
        ObjectMapper strict = mapper.copy()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS);
        strict.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return strict;
    }

    /**
     * Fetches one page of the list resource.
     *
     * @param limit  page size, sent as the {@code limit} query parameter
     * @param offset index of the first entry, sent as the {@code offset} query parameter
     * @return the decoded page
     * @throws UpstreamTransportException  if the request could not be completed
     * @throws UpstreamHttpStatusException if the upstream answered with a non-2xx status
     * @throws UpstreamDecodeException     if the body is not a valid list page
     */
    public PokemonListPage fetchPage(long limit, long offset) {
        URI target = listUri(limit, offset);
        HttpGet get = new HttpGet(target);
        get.addHeader("Accept", "application/json");

        log.debug("GET {}", target);
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            StatusLine statusLine = response.getStatusLine();
            int status = statusLine.getStatusCode();
            HttpEntity entity = response.getEntity();
            if (status < 200 || status > 299) {
                EntityUtils.consumeQuietly(entity);
                log.warn("Upstream {} answered HTTP {} (limit={}, offset={})", target, status, limit, offset);
                throw new UpstreamHttpStatusException(target.toString(), status, statusLine.getReasonPhrase());
            }
            if (entity == null) {
                throw new UpstreamDecodeException("Empty response body from " + target, null);
            }
            byte[] body = EntityUtils.toByteArray(entity);
            return decode(target, body);
        } catch (IOException e) {
            log.warn("Request to {} failed (limit={}, offset={}): {}", target, limit, offset, e.toString());
            throw new UpstreamTransportException("Request to " + target + " failed: " + e.getMessage(), e);
        }
    }

    URI listUri(long limit, long offset) {
        try {
            return new URIBuilder(listLocation)
                    .addParameter("limit", Long.toString(limit))
                    .addParameter("offset", Long.toString(offset))
                    .build();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Could not build list URL from " + listLocation, e);
        }
    }

    private PokemonListPage decode(URI target, byte[] body) {
        try {
            PokemonListPage page = mapper.readValue(body, PokemonListPage.class);
            if (page == null) {
                throw new UpstreamDecodeException("Response body from " + target + " is JSON null", null);
            }
            return page;
        } catch (JsonProcessingException e) {
            log.warn("Could not decode list page from {}: {}", target, e.getOriginalMessage());
            throw new UpstreamDecodeException("Invalid list page from " + target + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UpstreamTransportException("Could not read body from " + target, e);
        }
    }
}
