package com.movie.night.client;

import java.util.List;
import java.util.Optional;

/**
 * Videos the metadata provider lists for an exact title match.
 *
 * @param slug   canonical title slug of the matched record, usable as a search query; may be null
 * @param videos listed videos in provider order
 */
public record VideoListing(String slug, List<VideoEntry> videos) {

    public VideoListing {
        videos = videos != null ? List.copyOf(videos) : List.of();
    }

    /**
     * Key of the first YouTube entry typed {@code Trailer}.
     */
    public Optional<String> firstYouTubeTrailerKey() {
        return videos.stream()
                .filter(VideoEntry::isYouTubeTrailer)
                .map(VideoEntry::key)
                .findFirst();
    }

    public boolean hasSlug() {
        return slug != null && !slug.isBlank();
    }

    /**
     * @param site hosting site, e.g. {@code YouTube}
     * @param type video type, e.g. {@code Trailer} or {@code Teaser}
     * @param key  site-specific video key
     */
    public record VideoEntry(String site, String type, String key) {

        public boolean isYouTubeTrailer() {
            return "YouTube".equals(site) && "Trailer".equals(type) && key != null && !key.isBlank();
        }
    }
}
