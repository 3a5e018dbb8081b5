package com.example.tagsync.model;

import java.util.List;

/**
 * A local track together with the candidates the provider returned for it.
 */
public record TrackCandidates(
    String localTrackId,
    String localTitle,
    String localArtist,
    String localFilename,
    Double localDuration,
    List<Candidate> candidates
) {

    public static TrackCandidates of(LocalTrack track, List<Candidate> candidates) {
        return new TrackCandidates(
                track.id(),
                track.title(),
                track.artist(),
                track.fileName(),
                track.duration(),
                List.copyOf(candidates));
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }
}
