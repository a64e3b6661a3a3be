package com.movie.night.scoring;

/**
 * Beta posterior summary of a rating histogram.
 *
 * @param mean     posterior mean on a 0-10 scale
 * @param variance posterior variance on the same scale
 */
public record Posterior(double mean, double variance) {

    public Posterior {
        if (variance <= 0.0) {
            throw new IllegalArgumentException("variance must be positive");
        }
    }
}
