package com.movie.night.identity;

/**
 * Maps a title to a fixed-length vector whose cosine similarity reflects how alike two titles are.
 * Implementations may wrap a semantic sentence-embedding model; the default is
 * {@link HashingTitleEmbedder}.
 */
public interface TitleEmbedder {

    /**
     * Embeds a non-blank title. The returned vector always has {@link #dimensions()} entries.
     */
    double[] embed(String title);

    /**
     * Length of every vector this embedder produces.
     */
    int dimensions();

    /**
     * Returns the name of this embedder.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
