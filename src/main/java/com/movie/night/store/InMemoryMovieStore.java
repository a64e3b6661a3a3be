package com.movie.night.store;

import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.model.RatingSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link MovieStore}. Suitable for tests and single-process use.
 */
public class InMemoryMovieStore implements MovieStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMovieStore.class);

    private final AtomicLong idSequence = new AtomicLong();
    private final ConcurrentSkipListMap<Long, Movie> movies = new ConcurrentSkipListMap<>();
    private final Map<String, Long> aliases = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> genres = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> themes = new ConcurrentHashMap<>();
    // movieId -> source -> sample
    private final Map<Long, Map<String, RatingSample>> ratings = new ConcurrentHashMap<>();

    @Override
    public long addMovie(Movie.Builder movie) {
        long id = idSequence.incrementAndGet();
        Movie created = movie.id(id).build();
        movies.put(id, created);
        log.debug("movie.added id={} title='{}'", id, created.getTitle());
        return id;
    }

    @Override
    public Optional<Movie> findById(long movieId) {
        Movie movie = movies.get(movieId);
        return movie != null ? Optional.of(copyOf(movie)) : Optional.empty();
    }

    @Override
    public Optional<Long> findIdByTitle(String title) {
        if (title == null) {
            return Optional.empty();
        }
        for (Movie movie : movies.values()) {
            if (title.equals(movie.getTitle())) {
                return Optional.of(movie.getId());
            }
        }
        return Optional.ofNullable(aliases.get(title));
    }

    @Override
    public void addAlias(long movieId, String alias) {
        requireMovie(movieId);
        aliases.put(alias, movieId);
    }

    @Override
    public Map<Long, String> titlesById() {
        Map<Long, String> titles = new LinkedHashMap<>();
        movies.forEach((id, movie) -> titles.put(id, movie.getTitle()));
        return titles;
    }

    @Override
    public boolean isFieldMissing(long movieId, MovieField field) {
        Movie movie = movies.get(movieId);
        if (movie == null) {
            return true;
        }
        synchronized (movie) {
            return movie.isMissing(field);
        }
    }

    @Override
    public void updateField(long movieId, MovieField field, Object value) {
        Movie movie = requireMovie(movieId);
        synchronized (movie) {
            movie.set(field, value);
        }
        log.trace("movie.field.updated id={} field={}", movieId, field);
    }

    @Override
    public void linkGenre(long movieId, String genre) {
        requireMovie(movieId);
        genres.computeIfAbsent(movieId, k -> ConcurrentHashMap.newKeySet()).add(genre);
    }

    @Override
    public Set<String> genres(long movieId) {
        return Set.copyOf(genres.getOrDefault(movieId, Set.of()));
    }

    @Override
    public void linkTheme(long movieId, String theme) {
        requireMovie(movieId);
        themes.computeIfAbsent(movieId, k -> ConcurrentHashMap.newKeySet()).add(theme);
    }

    @Override
    public Set<String> themes(long movieId) {
        return Set.copyOf(themes.getOrDefault(movieId, Set.of()));
    }

    @Override
    public void upsertRating(RatingSample sample) {
        requireMovie(sample.movieId());
        ratings.computeIfAbsent(sample.movieId(), k -> new ConcurrentHashMap<>()).put(sample.source(), sample);
        log.trace("rating.upserted movieId={} source={} score={}", sample.movieId(), sample.source(), sample.score());
    }

    @Override
    public Optional<RatingSample> rating(long movieId, String source) {
        Map<String, RatingSample> bySource = ratings.get(movieId);
        if (bySource == null || source == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySource.get(source.trim().toUpperCase(Locale.ROOT)));
    }

    @Override
    public List<RatingSample> ratings(long movieId) {
        Map<String, RatingSample> bySource = ratings.getOrDefault(movieId, Map.of());
        return List.copyOf(new TreeMap<>(bySource).values());
    }

    @Override
    public List<Long> movieIdsAfter(long resumeAfter) {
        return List.copyOf(movies.tailMap(resumeAfter, false).keySet());
    }

    @Override
    public List<Long> movieIdsMissing(MovieField field, long resumeAfter) {
        List<Long> ids = new ArrayList<>();
        for (Map.Entry<Long, Movie> entry : movies.tailMap(resumeAfter, false).entrySet()) {
            Movie movie = entry.getValue();
            synchronized (movie) {
                if (movie.isMissing(field)) {
                    ids.add(entry.getKey());
                }
            }
        }
        return Collections.unmodifiableList(ids);
    }

    @Override
    public Map<String, Double> catalogueShareByCountry() {
        Map<String, Integer> counts = new TreeMap<>();
        int total = 0;
        for (Movie movie : movies.values()) {
            String origin;
            synchronized (movie) {
                origin = movie.getOriginCountry();
            }
            if (origin == null || origin.isBlank()) {
                continue;
            }
            counts.merge(origin.toUpperCase(Locale.ROOT), 1, Integer::sum);
            total++;
        }
        Map<String, Double> shares = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            shares.put(entry.getKey(), (double) entry.getValue() / total);
        }
        return Collections.unmodifiableMap(shares);
    }

    @Override
    public long count() {
        return movies.size();
    }

    /**
     * Genre names across all movies, sorted.
     */
    public Set<String> allGenres() {
        Set<String> all = new TreeSet<>();
        genres.values().forEach(all::addAll);
        return all;
    }

    private Movie requireMovie(long movieId) {
        Movie movie = movies.get(movieId);
        if (movie == null) {
            throw new MovieNotFoundException(movieId);
        }
        return movie;
    }

    private static Movie copyOf(Movie movie) {
        synchronized (movie) {
            return movie.copy();
        }
    }
}
