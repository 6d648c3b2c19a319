package io.github.devsha256.pokedexgateway.service;

import io.github.devsha256.pokedexgateway.client.PokeApiClient;
import io.github.devsha256.pokedexgateway.dto.PokemonListPage;
import io.github.devsha256.pokedexgateway.dto.PokemonReference;
import io.github.devsha256.pokedexgateway.model.Pokemon;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one page from the upstream API and reshapes every entry into a {@link Pokemon}.
 * <p>
 * All or nothing: if any entry cannot be converted the whole page fails. Nothing is cached,
 * every call goes upstream.
 */
@Service
public class PokemonListService {

    public static final long DEFAULT_LIMIT = 20;
    public static final long DEFAULT_OFFSET = 0;

    private final PokeApiClient client;
    private final PokemonIdExtractor extractor;

    public PokemonListService(PokeApiClient client, PokemonIdExtractor extractor) {
        this.client = client;
        this.extractor = extractor;
    }

    /**
     * @return entries in upstream order, possibly empty
     * @throws io.github.devsha256.pokedexgateway.exception.UpstreamException if the upstream call fails
     * @throws PokemonIdExtractor.ExtractionException if any entry has an unusable URL
     */
    public List<Pokemon> list(long limit, long offset) {
        PokemonListPage page = client.fetchPage(limit, offset);
        List<Pokemon> result = new ArrayList<>(page.results().size());
        for (PokemonReference reference : page.results()) {
            result.add(extractor.extract(reference));
        }
        return result;
    }
}
