package com.movie.night.client;

import java.util.Optional;

/**
 * Primary metadata provider (TMDb-shaped). Implementations resolve a title to exactly one
 * provider record and return empty when no unambiguous match exists.
 *
 * <p>Implementations throw {@link RateLimitExceededException} when the provider refuses
 * service and {@link ProviderException} on transport failures.</p>
 */
public interface MetadataProviderClient {

    Optional<ProviderMetadata> fetchMetadata(String title);

    Optional<UserRating> fetchUserRating(String title);

    /**
     * Video listing of the exact-title match, including its canonical slug.
     */
    Optional<VideoListing> fetchVideosExact(String title);

    /**
     * Returns the name of this provider.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
