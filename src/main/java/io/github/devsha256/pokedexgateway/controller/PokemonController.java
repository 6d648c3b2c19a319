package io.github.devsha256.pokedexgateway.controller;

import io.github.devsha256.pokedexgateway.exception.UpstreamException;
import io.github.devsha256.pokedexgateway.model.Pokemon;
import io.github.devsha256.pokedexgateway.service.PokemonIdExtractor;
import io.github.devsha256.pokedexgateway.service.PokemonListService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Pokemon")
public class PokemonController {

    private static final Logger log = LoggerFactory.getLogger(PokemonController.class);

    static final long MAX_U32 = 0xFFFF_FFFFL;

    private final PokemonListService listService;

    public PokemonController(PokemonListService listService) {
        this.listService = listService;
    }

    /**
     * GET /api/pokemon?limit=20&offset=0
     * Response: [{ id, name }, ...] in upstream order, or 500 with no body if the
     * upstream call or any entry fails.
     */
    @GetMapping("/pokemon")
    @Operation(summary = "List pokemon", description = "Fetches one page from PokeAPI and returns id/name pairs.")
    @ApiResponse(responseCode = "200", description = "The requested page")
    @ApiResponse(responseCode = "500", description = "Upstream failure or an entry without a numeric id")
    public ResponseEntity<List<Pokemon>> pokemon(
            @Parameter(description = "Page size, default 20")
            @RequestParam(required = false) @Min(0) @Max(MAX_U32) Long limit,
            @Parameter(description = "Index of the first entry, default 0")
            @RequestParam(required = false) @Min(0) @Max(MAX_U32) Long offset) {
        long effectiveLimit = limit == null ? PokemonListService.DEFAULT_LIMIT : limit;
        long effectiveOffset = offset == null ? PokemonListService.DEFAULT_OFFSET : offset;
        try {
            return ResponseEntity.ok(listService.list(effectiveLimit, effectiveOffset));
        } catch (UpstreamException e) {
            log.error("Upstream request failed (limit={}, offset={}): {}", effectiveLimit, effectiveOffset, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        } catch (PokemonIdExtractor.ExtractionException e) {
            log.error("Rejecting page (limit={}, offset={}): {} [reason={}, url={}]",
                    effectiveLimit, effectiveOffset, e.getMessage(), e.getReason(), e.getUrl());
            return ResponseEntity.internalServerError().build();
        }
    }
}
