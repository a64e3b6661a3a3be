package com.movie.night.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.movie.night.identity.FieldParsers;
import com.movie.night.reference.ReleaseWindowClassifier;
import com.movie.night.trailer.VideoUrls;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a TMDb-shaped movie-details payload (requested with {@code release_dates,videos}
 * appended) into {@link ProviderMetadata}. Client implementations call this after fetching.
 */
public class ProviderPayloadParser {

    static final String DEFAULT_ORIGIN = "US";
    static final int THEATRICAL_RELEASE_TYPE = 3;

    private final ReleaseWindowClassifier windowClassifier;

    public ProviderPayloadParser(ReleaseWindowClassifier windowClassifier) {
        this.windowClassifier = Objects.requireNonNull(windowClassifier, "windowClassifier must not be null");
    }

    public ProviderMetadata parse(JsonNode details) {
        Objects.requireNonNull(details, "details must not be null");

        String releaseDate = FieldParsers.text(details, "release_date");
        String origin = originCountry(details);
        Integer runtime = FieldParsers.runtimeMinutes(details, "runtime");

        JsonNode id = details.get("id");
        JsonNode revenue = details.get("revenue");

        return ProviderMetadata.builder()
                .title(FieldParsers.text(details, "title"))
                .year(FieldParsers.parseYear(releaseDate))
                .releaseWindow(windowClassifier.classify(releaseDate, origin))
                .ratingCertification(certification(details, origin))
                .durationSeconds(runtime != null ? runtime * 60 : null)
                .trailerUrl(firstTrailerUrl(details))
                .originCountry(origin)
                .boxOfficeActual(revenue != null && revenue.canConvertToLong() && revenue.asLong() > 0
                        ? revenue.asLong() : null)
                .franchise(FieldParsers.text(details.path("belongs_to_collection"), "name"))
                .externalId(FieldParsers.text(details, "imdb_id"))
                .providerId(id != null && id.canConvertToLong() ? id.asLong() : null)
                .genres(genres(details))
                .rawPayload(details)
                .build();
    }

    /**
     * First production country's ISO code, {@code US} when none is listed.
     */
    static String originCountry(JsonNode details) {
        JsonNode countries = details.path("production_countries");
        if (countries.isArray() && countries.size() > 0) {
            String code = FieldParsers.text(countries.get(0), "iso_3166_1");
            if (code != null) {
                return code.toUpperCase(Locale.ROOT);
            }
        }
        return DEFAULT_ORIGIN;
    }

    /**
     * First non-empty theatrical certification for the origin country.
     */
    static String certification(JsonNode details, String country) {
        for (JsonNode block : details.path("release_dates").path("results")) {
            if (!country.equalsIgnoreCase(block.path("iso_3166_1").asText())) {
                continue;
            }
            for (JsonNode release : block.path("release_dates")) {
                String cert = FieldParsers.text(release, "certification");
                if (release.path("type").asInt() == THEATRICAL_RELEASE_TYPE && cert != null) {
                    return cert;
                }
            }
        }
        return null;
    }

    static String firstTrailerUrl(JsonNode details) {
        for (JsonNode video : details.path("videos").path("results")) {
            String key = FieldParsers.text(video, "key");
            if ("YouTube".equals(video.path("site").asText())
                    && "Trailer".equals(video.path("type").asText())
                    && key != null) {
                return VideoUrls.watchUrl(key);
            }
        }
        return null;
    }

    static List<String> genres(JsonNode details) {
        List<String> names = new ArrayList<>();
        for (JsonNode genre : details.path("genres")) {
            String name = FieldParsers.text(genre, "name");
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }
}
