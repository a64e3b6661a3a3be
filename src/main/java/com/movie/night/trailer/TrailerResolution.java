package com.movie.night.trailer;

import java.util.Objects;

/**
 * Outcome of a trailer lookup.
 *
 * @param url        canonical watch URL, null when nothing was found
 * @param source     tier that produced the URL
 * @param confidence confidence of that tier
 */
public record TrailerResolution(String url, TrailerSource source, double confidence) {

    public TrailerResolution {
        Objects.requireNonNull(source, "source must not be null");
        if (url == null && source != TrailerSource.NONE) {
            throw new IllegalArgumentException("url is required for source " + source);
        }
    }

    public static TrailerResolution of(String url, TrailerSource source) {
        return new TrailerResolution(url, source, source.getConfidence());
    }

    public static TrailerResolution notFound() {
        return new TrailerResolution(null, TrailerSource.NONE, 0.0);
    }

    public String sourceTag() {
        return source.getTag();
    }

    public boolean found() {
        return url != null;
    }
}
