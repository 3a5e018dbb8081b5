package com.example.tagsync.model;

import java.util.List;

/**
 * Tag values taken from a provider track and written back to the local library.
 * Null fields are left untouched on the local side.
 */
public record TrackTags(
    String title,
    String artist,
    Double bpm,
    String key,
    String genre,
    String label,
    String album,
    Integer year,
    String isrc,
    String catalogNumber,
    String artworkUrl,
    Long providerTrackId
) {

    private static final String ORIGINAL_MIX = "original mix";

    public static TrackTags from(ProviderTrack track) {
        return new TrackTags(
                fullTitle(track.name(), track.mixName()),
                joinArtists(track.artists()),
                track.bpm(),
                track.key(),
                track.genre(),
                track.label(),
                track.album(),
                parseYear(track.publishDate()),
                track.isrc(),
                track.catalogNumber(),
                track.artworkUrl(),
                track.id());
    }

    /**
     * Tags to write over the given local track. Provider values win, except that a BPM already
     * present locally is kept.
     */
    public TrackTags mergedWith(LocalTrack local) {
        if (local == null || local.bpm() == null || bpm == null) {
            return this;
        }
        return new TrackTags(title, artist, null, key, genre, label, album, year, isrc, catalogNumber,
                artworkUrl, providerTrackId);
    }

    /**
     * "Name (Mix)" unless the mix is empty or the default original mix.
     */
    static String fullTitle(String name, String mixName) {
        if (name == null) {
            return null;
        }
        if (mixName == null || mixName.isBlank() || mixName.trim().equalsIgnoreCase(ORIGINAL_MIX)) {
            return name;
        }
        return name + " (" + mixName.trim() + ")";
    }

    static String joinArtists(List<String> artists) {
        if (artists == null || artists.isEmpty()) {
            return null;
        }
        String joined = String.join(", ", artists);
        return joined.isBlank() ? null : joined;
    }

    /**
     * Year from an ISO date such as 2021-03-05.
     */
    static Integer parseYear(String publishDate) {
        if (publishDate == null || publishDate.isBlank()) {
            return null;
        }
        String yearPart = publishDate.split("-", 2)[0].trim();
        try {
            return Integer.parseInt(yearPart);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
