package com.movie.night.client;

import java.util.Optional;

/**
 * Optional scraper for the primary ratings site, keyed by external id.
 */
@FunctionalInterface
public interface DetailScraper {

    Optional<ScrapedDetails> fetchAll(String externalId);
}
