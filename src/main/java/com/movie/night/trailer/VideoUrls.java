package com.movie.night.trailer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube URL helpers. A URL is valid when an 11-character video id can be extracted from it.
 */
public final class VideoUrls {

    private static final String WATCH_PREFIX = "https://www.youtube.com/watch?v=";
    private static final Pattern VIDEO_ID_IN_URL =
            Pattern.compile("(?:v=|/videos/|embed/|youtu\\.be/)([A-Za-z0-9_-]{11})");
    private static final Pattern BARE_VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");

    private VideoUrls() {
    }

    public static Optional<String> extractVideoId(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = VIDEO_ID_IN_URL.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static boolean isValid(String url) {
        return extractVideoId(url).isPresent();
    }

    public static String watchUrl(String videoId) {
        return WATCH_PREFIX + videoId;
    }

    /**
     * Canonical watch URL for a search result that is either a bare video id or a URL.
     * Returns empty when neither form yields an id.
     */
    public static Optional<String> normalize(String idOrUrl) {
        if (idOrUrl == null) {
            return Optional.empty();
        }
        String candidate = idOrUrl.trim();
        if (BARE_VIDEO_ID.matcher(candidate).matches()) {
            return Optional.of(watchUrl(candidate));
        }
        return extractVideoId(candidate).map(VideoUrls::watchUrl);
    }
}
