package io.github.devsha256.pokedexgateway;

import com.sun.net.httpserver.HttpServer;
import io.github.devsha256.pokedexgateway.exception.InvalidBaseUrlException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the whole application against a local stand-in for PokeAPI.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PokedexGatewayApplicationTest {

    private static final HttpServer upstream = startUpstream();
    private static final AtomicInteger upstreamStatus = new AtomicInteger(200);
    private static final AtomicReference<String> upstreamBody = new AtomicReference<>("");
    private static final AtomicReference<String> upstreamQuery = new AtomicReference<>();

    @Autowired
    TestRestTemplate rest;

    @DynamicPropertySource
    static void upstreamProperties(DynamicPropertyRegistry registry) {
        registry.add("pokeapi.base-url", () -> "http://localhost:" + upstream.getAddress().getPort() + "/api/v2/");
    }

    @AfterAll
    static void stopUpstream() {
        upstream.stop(0);
    }

    @BeforeEach
    void resetUpstream() {
        upstreamStatus.set(200);
        upstreamBody.set("");
        upstreamQuery.set(null);
    }

    @Test
    void listsPokemonFromUpstream() {
        upstreamBody.set("""
                {"count":2,"next":null,"previous":null,"results":[
                  {"url":"https://pokeapi.co/api/v2/pokemon/1/","name":"bulbasaur"},
                  {"url":"https://pokeapi.co/api/v2/pokemon/2/","name":"ivysaur"}]}
                """);

        ResponseEntity<String> response = rest.getForEntity("/api/pokemon?limit=2&offset=0", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo("[{\"id\":1,\"name\":\"bulbasaur\"},{\"id\":2,\"name\":\"ivysaur\"}]");
    }

    @Test
    void upstream404Is500WithEmptyBody() {
        upstreamStatus.set(404);
        upstreamBody.set("{\"detail\":\"Not found.\"}");

        ResponseEntity<String> response = rest.getForEntity("/api/pokemon", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNull();
    }

    @Test
    void omittedParametersAskUpstreamForTwentyFromZero() {
        upstreamBody.set("{\"count\":0,\"next\":null,\"previous\":null,\"results\":[]}");

        ResponseEntity<String> response = rest.getForEntity("/api/pokemon", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo("[]");
        assertThat(upstreamQuery.get()).isEqualTo("limit=20&offset=0");
    }

    @Test
    void oneMalformedUrlFailsTheWholeBatch() {
        upstreamBody.set("""
                {"count":2,"next":null,"previous":null,"results":[
                  {"url":"https://pokeapi.co/api/v2/pokemon/1/","name":"bulbasaur"},
                  {"url":"not a url","name":"missingno"}]}
                """);

        ResponseEntity<String> response = rest.getForEntity("/api/pokemon", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNull();
    }

    @Test
    void repeatedCallsGiveTheSameResult() {
        upstreamBody.set("""
                {"count":1,"next":null,"previous":null,"results":[
                  {"url":"https://pokeapi.co/api/v2/pokemon/25/","name":"pikachu"}]}
                """);

        String first = rest.getForObject("/api/pokemon?limit=1&offset=24", String.class);
        String second = rest.getForObject("/api/pokemon?limit=1&offset=24", String.class);

        assertThat(first).isEqualTo("[{\"id\":25,\"name\":\"pikachu\"}]").isEqualTo(second);
    }

    @Test
    void publishesOpenApiDocument() {
        ResponseEntity<String> response = rest.getForEntity("/v3/api-docs", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("/api/pokemon").contains("Pokedex Gateway");
    }

    @Test
    void refusesToStartWithInvalidBaseUrl() {
        SpringApplicationBuilder app = new SpringApplicationBuilder(PokedexGatewayApplication.class)
                .web(WebApplicationType.NONE);

        assertThatThrownBy(() -> {
            try (ConfigurableApplicationContext ignored = app.run("--pokeapi.base-url=mailto:ash@example.com")) {
                // only reached if startup wrongly succeeds
            }
        }).hasRootCauseInstanceOf(InvalidBaseUrlException.class);
    }

    private static HttpServer startUpstream() {
        try {
            HttpServer server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
            server.createContext("/api/v2/pokemon", exchange -> {
                upstreamQuery.set(exchange.getRequestURI().getRawQuery());
                byte[] body = upstreamBody.get().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "application/json");
                exchange.sendResponseHeaders(upstreamStatus.get(), body.length == 0 ? -1 : body.length);
                if (body.length > 0) {
                    exchange.getResponseBody().write(body);
                }
                exchange.close();
            });
            server.start();
            return server;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
