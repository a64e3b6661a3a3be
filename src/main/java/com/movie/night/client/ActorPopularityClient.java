package com.movie.night.client;

import java.util.OptionalDouble;

/**
 * Popularity of a movie's cast, 0-100.
 */
@FunctionalInterface
public interface ActorPopularityClient {

    OptionalDouble fetchPopularity(String title);
}
