package io.github.devsha256.pokedexgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PokedexGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PokedexGatewayApplication.class, args);
    }
}
