package com.example.tagsync.client;

import com.example.tagsync.exception.ProviderException;
import com.example.tagsync.model.Candidate;
import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.ProviderTrack;

import java.util.List;

/**
 * External metadata provider. Implementations must be safe for concurrent use.
 */
public interface MetadataClient {

    /**
     * Candidates for a local track, best first, at most {@code maxResults}, none below {@code minScore}.
     * An empty list means the provider had no acceptable match.
     */
    List<Candidate> search(LocalTrack track, int maxResults, double minScore) throws ProviderException;

    ProviderTrack fetchTrack(long providerTrackId) throws ProviderException;
}
