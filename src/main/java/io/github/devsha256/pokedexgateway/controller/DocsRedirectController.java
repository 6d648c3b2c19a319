package io.github.devsha256.pokedexgateway.controller;

import io.swagger.v3.oas.annotations.Hidden;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the API documentation from the root path.
 */
@Hidden
@Controller
public class DocsRedirectController {

    @GetMapping("/")
    public String docs() {
        return "redirect:/swagger-ui/index.html";
    }
}
