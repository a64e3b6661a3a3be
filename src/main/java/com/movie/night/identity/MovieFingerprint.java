package com.movie.night.identity;

import java.util.Arrays;
import java.util.Objects;

/**
 * Source-agnostic summary of one metadata payload, used only to decide whether two
 * payloads describe the same film. Never persisted.
 *
 * @param source          the payload's source
 * @param externalId      IMDb-style id ({@code tt...}), or null
 * @param title           display title, or null
 * @param titleEmbedding  fixed-length title vector, or null when the title is missing
 * @param runtimeMinutes  runtime in minutes, or null
 * @param releaseYear     release year, or null
 */
public record MovieFingerprint(
        MetadataSource source,
        String externalId,
        String title,
        double[] titleEmbedding,
        Integer runtimeMinutes,
        Integer releaseYear
) {
    public MovieFingerprint {
        Objects.requireNonNull(source, "source must not be null");
        titleEmbedding = titleEmbedding != null ? titleEmbedding.clone() : null;
    }

    @Override
    public double[] titleEmbedding() {
        return titleEmbedding != null ? titleEmbedding.clone() : null;
    }

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }

    public boolean hasTitleEmbedding() {
        return titleEmbedding != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MovieFingerprint other)) return false;
        return source == other.source
                && Objects.equals(externalId, other.externalId)
                && Objects.equals(title, other.title)
                && Arrays.equals(titleEmbedding, other.titleEmbedding)
                && Objects.equals(runtimeMinutes, other.runtimeMinutes)
                && Objects.equals(releaseYear, other.releaseYear);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(source, externalId, title, runtimeMinutes, releaseYear);
        return 31 * result + Arrays.hashCode(titleEmbedding);
    }

    @Override
    public String toString() {
        return "MovieFingerprint{source=" + source +
                ", externalId='" + externalId + '\'' +
                ", title='" + title + '\'' +
                ", runtimeMinutes=" + runtimeMinutes +
                ", releaseYear=" + releaseYear + '}';
    }
}
