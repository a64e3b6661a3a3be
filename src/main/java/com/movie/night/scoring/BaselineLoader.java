package com.movie.night.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.movie.night.reference.ReferenceDataException;
import com.movie.night.reference.ReferenceResources;
import com.movie.night.store.MovieStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds {@link Baselines} from the bundled population snapshot and the store's catalogue.
 */
public final class BaselineLoader {
    private static final Logger log = LoggerFactory.getLogger(BaselineLoader.class);

    private BaselineLoader() {
    }

    public static Baselines load(MovieStore store) {
        return fromJson(ReferenceResources.read(ReferenceResources.BASELINES))
                .withCatalogueShare(store.catalogueShareByCountry());
    }

    /**
     * Population and penetration tables only; the catalogue share is left empty.
     */
    static Baselines fromJson(JsonNode root) {
        Map<String, Double> population = readShares(root, "populationShare");
        Map<String, Double> penetration = readShares(root, "internetPenetration");
        log.debug("baselines.loaded countries={} penetration={}", population.size(), penetration.size());
        return new Baselines(population, Map.of(), penetration);
    }

    private static Map<String, Double> readShares(JsonNode root, String field) {
        JsonNode table = root.path(field);
        if (!table.isObject()) {
            throw new ReferenceDataException("Baselines resource has no '" + field + "' table");
        }
        Map<String, Double> shares = new HashMap<>();
        table.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isNumber()) {
                throw new ReferenceDataException("Non-numeric " + field + " for " + entry.getKey());
            }
            shares.put(entry.getKey(), entry.getValue().asDouble());
        });
        return shares;
    }
}
