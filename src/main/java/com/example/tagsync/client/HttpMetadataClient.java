package com.example.tagsync.client;

import com.example.tagsync.exception.ProviderErrorKind;
import com.example.tagsync.exception.ProviderException;
import com.example.tagsync.model.Candidate;
import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.ProviderTrack;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link MetadataClient} against the provider's JSON gateway.
 *
 * Endpoints:
 * - GET {base}/search?title=&artist=&duration=&limit=  → {"tracks": [...]}
 * - GET {base}/tracks/{id}                              → single track
 *
 * Search hits are scored locally with {@link CandidateScorer}.
 */
@Component
@Slf4j
public class HttpMetadataClient implements MetadataClient {

    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);
    // the gateway is asked for more hits than we keep, since scoring happens here
    static final int SEARCH_FETCH_LIMIT = 25;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiToken;
    private final Duration requestTimeout;

    public HttpMetadataClient(
            ObjectMapper objectMapper,
            @Value("${app.provider.base-url:http://localhost:9090/catalog}") String baseUrl,
            @Value("${app.provider.api-token:}") String apiToken,
            @Value("${app.provider.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${app.provider.request-timeout-ms:15000}") long requestTimeoutMs) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = apiToken;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        log.info("HttpMetadataClient initialized: baseUrl={}, auth={}", this.baseUrl,
                apiToken == null || apiToken.isBlank() ? "none" : "bearer");
    }

    @Override
    public List<Candidate> search(LocalTrack track, int maxResults, double minScore) throws ProviderException {
        String query = "title=" + encode(track.title())
                + "&artist=" + encode(track.artist())
                + "&duration=" + (long) track.duration()
                + "&limit=" + SEARCH_FETCH_LIMIT;
        String body = get("/search?" + query);
        SearchResponse response = parse(body, SearchResponse.class);
        List<GatewayTrack> hits = response.tracks() == null ? List.of() : response.tracks();

        List<Candidate> candidates = hits.stream()
                .map(hit -> hit.toCandidate(CandidateScorer.score(track, hit.name(), hit.artists(), hit.durationSecs())))
                .filter(candidate -> candidate.similarityScore() >= minScore)
                .sorted(Comparator.comparingDouble(Candidate::similarityScore).reversed())
                .limit(maxResults)
                .toList();
        log.debug("Search for {} returned {} hits, {} candidates kept", track.id(), hits.size(), candidates.size());
        return candidates;
    }

    @Override
    public ProviderTrack fetchTrack(long providerTrackId) throws ProviderException {
        String body = get("/tracks/" + providerTrackId);
        return parse(body, GatewayTrack.class).toProviderTrack();
    }

    private String get(String pathAndQuery) throws ProviderException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        if (apiToken != null && !apiToken.isBlank()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException(ProviderErrorKind.NETWORK, "Provider unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorKind.NETWORK, "Provider call interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw toException(status, pathAndQuery, response);
    }

    private static ProviderException toException(int status, String path, HttpResponse<?> response) {
        if (status == 429) {
            return ProviderException.rateLimited(retryAfter(response));
        }
        if (status == 404) {
            return new ProviderException(ProviderErrorKind.NOT_FOUND, "Not found on provider: " + path);
        }
        if (status == 401 || status == 403) {
            return new ProviderException(ProviderErrorKind.AUTH, "Provider rejected credentials (HTTP " + status + ")");
        }
        return new ProviderException(ProviderErrorKind.OTHER, "Provider returned HTTP " + status + " for " + path);
    }

    static Duration retryAfter(HttpResponse<?> response) {
        Optional<String> header = response.headers().firstValue("Retry-After");
        if (header.isEmpty()) {
            return DEFAULT_RETRY_AFTER;
        }
        try {
            long seconds = Long.parseLong(header.get().trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER;
        }
    }

    private <T> T parse(String body, Class<T> type) throws ProviderException {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderErrorKind.PARSE,
                    "Unreadable provider response: " + e.getOriginalMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    record SearchResponse(List<GatewayTrack> tracks) {}

    record GatewayTrack(
            long id,
            String name,
            @JsonProperty("mix_name") String mixName,
            List<String> artists,
            Double bpm,
            String key,
            String genre,
            String label,
            String release,
            @JsonProperty("publish_date") String publishDate,
            String isrc,
            @JsonProperty("catalog_number") String catalogNumber,
            @JsonProperty("length_ms") Long lengthMs,
            @JsonProperty("image_url") String imageUrl
    ) {

        Double durationSecs() {
            return lengthMs == null ? null : lengthMs / 1000.0;
        }

        Candidate toCandidate(double score) {
            return new Candidate(id, name, mixName,
                    artists == null ? "" : String.join(", ", artists),
                    bpm, key, durationSecs(), imageUrl, score, genre, label, publishDate);
        }

        ProviderTrack toProviderTrack() {
            return new ProviderTrack(id, name, mixName,
                    artists == null ? List.of() : List.copyOf(artists),
                    bpm, key, genre, label, release, publishDate, isrc, catalogNumber, imageUrl);
        }
    }
}
