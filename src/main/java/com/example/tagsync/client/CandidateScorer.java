package com.example.tagsync.client;

import com.example.tagsync.model.LocalTrack;

import java.util.List;
import java.util.Locale;

/**
 * Scores provider search hits against a local track.
 *
 * Weighted: 50% title similarity, 30% artist similarity, 20% duration closeness.
 */
public final class CandidateScorer {

    static final double TITLE_WEIGHT = 0.5;
    static final double ARTIST_WEIGHT = 0.3;
    static final double DURATION_WEIGHT = 0.2;
    static final double UNKNOWN_DURATION_SCORE = 0.7;

    private CandidateScorer() {}

    public static double score(LocalTrack local, String title, List<String> artists, Double durationSecs) {
        double titleScore = similarity(normalize(local.title()), normalize(title));
        double artistScore = similarity(normalize(local.artist()), normalizeArtists(artists));
        Double localDuration = local.duration() > 0 ? local.duration() : null;
        double durationScore = durationScore(localDuration, durationSecs);
        return titleScore * TITLE_WEIGHT + artistScore * ARTIST_WEIGHT + durationScore * DURATION_WEIGHT;
    }

    /**
     * Lower case, letters/digits/whitespace only, whitespace collapsed.
     */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder kept = new StringBuilder(value.length());
        value.toLowerCase(Locale.ROOT).codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || Character.isWhitespace(cp))
                .forEach(kept::appendCodePoint);
        return String.join(" ", kept.toString().trim().split("\\s+")).trim();
    }

    private static String normalizeArtists(List<String> artists) {
        if (artists == null || artists.isEmpty()) {
            return "";
        }
        return normalize(String.join(" ", artists));
    }

    /**
     * Levenshtein similarity in [0, 1].
     */
    static double similarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int[] ac = a.codePoints().toArray();
        int[] bc = b.codePoints().toArray();
        int[] previous = new int[bc.length + 1];
        int[] current = new int[bc.length + 1];
        for (int j = 0; j <= bc.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= ac.length; i++) {
            current[0] = i;
            for (int j = 1; j <= bc.length; j++) {
                int cost = ac[i - 1] == bc[j - 1] ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        int distance = previous[bc.length];
        return 1.0 - (double) distance / Math.max(ac.length, bc.length);
    }

    static double durationScore(Double localSecs, Double remoteSecs) {
        if (localSecs == null || remoteSecs == null) {
            return UNKNOWN_DURATION_SCORE;
        }
        double diff = Math.abs(localSecs - remoteSecs);
        if (diff <= 5.0) return 1.0;
        if (diff <= 15.0) return 0.8;
        if (diff <= 30.0) return 0.5;
        return 0.2;
    }
}
