package io.github.devsha256.pokedexgateway.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Pokedex Gateway",
                version = "1.0",
                description = "Lists Pokemon from PokeAPI as {id, name} pairs."),
        servers = @Server(url = "http://localhost:3001", description = "Local"))
public class OpenApiConfig { }
