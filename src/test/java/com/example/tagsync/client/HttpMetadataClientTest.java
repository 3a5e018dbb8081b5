package com.example.tagsync.client;

import com.example.tagsync.config.JacksonConfig;
import com.example.tagsync.exception.ProviderErrorKind;
import com.example.tagsync.exception.ProviderException;
import com.example.tagsync.model.Candidate;
import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.ProviderTrack;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * HttpMetadataClient against a local stub gateway.
 */
class HttpMetadataClientTest {

    private static final LocalTrack STROBE = new LocalTrack("t1", "/music/strobe.mp3", "Strobe", "deadmau5",
            null, null, null, 600.0, null, null, null, null, null);

    private static final String SEARCH_BODY = """
            {"tracks": [
              {"id": 3, "name": "Completely Different", "artists": ["Someone Else"], "length_ms": 100000},
              {"id": 2, "name": "Strobe", "artists": ["deadmau5"], "length_ms": 640000},
              {"id": 1, "name": "Strobe", "mix_name": "Original Mix", "artists": ["deadmau5"],
               "length_ms": 600000, "bpm": 128, "key": "A min", "image_url": "http://img/1.jpg",
               "publish_date": "2009-09-22", "extra_field": true}
            ]}
            """;

    private static final String TRACK_BODY = """
            {"id": 1, "name": "Strobe", "mix_name": "Radio Edit", "artists": ["deadmau5", "Kaskade"],
             "bpm": 128.0, "key": "A min", "genre": "Progressive House", "label": "mau5trap",
             "release": "For Lack of a Better Name", "publish_date": "2009-09-22", "isrc": "USUS10900001",
             "catalog_number": "MAU5-007", "image_url": "http://img/1.jpg"}
            """;

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();

    private volatile int status = 200;
    private volatile String body = "{}";
    private volatile String retryAfter;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/catalog/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastQuery.set(exchange.getRequestURI().getRawQuery());
        lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
        if (retryAfter != null) {
            exchange.getResponseHeaders().add("Retry-After", retryAfter);
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private HttpMetadataClient client(String token) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/catalog";
        return new HttpMetadataClient(new JacksonConfig().objectMapper(), baseUrl, token, 2000, 5000);
    }

    @Test
    @DisplayName("Search scores hits locally, drops weak ones and sorts best first")
    void searchScoresAndFilters() throws Exception {
        body = SEARCH_BODY;

        List<Candidate> candidates = client("").search(STROBE, 4, 0.25);

        assertThat(candidates).extracting(Candidate::providerTrackId).containsExactly(1L, 2L);
        assertThat(candidates.get(0).similarityScore()).isCloseTo(1.0, within(0.0001));
        assertThat(candidates.get(0).durationSecs()).isEqualTo(600.0);
        assertThat(candidates.get(0).artworkUrl()).isEqualTo("http://img/1.jpg");
        assertThat(candidates.get(1).similarityScore()).isCloseTo(0.84, within(0.001));
        assertThat(lastQuery.get()).contains("title=Strobe").contains("artist=deadmau5").contains("duration=600");
        assertThat(lastAuth.get()).isNull();
    }

    @Test
    @DisplayName("Search honours the result limit")
    void searchHonoursLimit() throws Exception {
        body = SEARCH_BODY;

        List<Candidate> candidates = client("").search(STROBE, 1, 0.25);

        assertThat(candidates).extracting(Candidate::providerTrackId).containsExactly(1L);
    }

    @Test
    @DisplayName("Empty search result is an empty list")
    void emptySearch() throws Exception {
        body = "{\"tracks\": []}";

        assertThat(client("").search(STROBE, 4, 0.25)).isEmpty();
    }

    @Test
    @DisplayName("Fetch maps the gateway track and sends the bearer token")
    void fetchTrack() throws Exception {
        body = TRACK_BODY;

        ProviderTrack track = client("secret").fetchTrack(1L);

        assertThat(track.id()).isEqualTo(1L);
        assertThat(track.mixName()).isEqualTo("Radio Edit");
        assertThat(track.artists()).containsExactly("deadmau5", "Kaskade");
        assertThat(track.album()).isEqualTo("For Lack of a Better Name");
        assertThat(track.catalogNumber()).isEqualTo("MAU5-007");
        assertThat(track.artworkUrl()).isEqualTo("http://img/1.jpg");
        assertThat(lastAuth.get()).isEqualTo("Bearer secret");
    }

    @Test
    @DisplayName("429 maps to RATE_LIMITED with the Retry-After value")
    void rateLimited() {
        status = 429;
        retryAfter = "7";

        assertThatThrownBy(() -> client("").fetchTrack(1L))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.isRateLimited()).isTrue();
                    assertThat(e.getRetryAfter()).contains(Duration.ofSeconds(7));
                });
    }

    @Test
    @DisplayName("429 without Retry-After defaults to 60s")
    void rateLimitedDefaultRetry() {
        status = 429;

        assertThatThrownBy(() -> client("").search(STROBE, 4, 0.25))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getRetryAfter()).contains(Duration.ofSeconds(60)));
    }

    @Test
    void notFound() {
        status = 404;
        assertKind(ProviderErrorKind.NOT_FOUND);
    }

    @Test
    void unauthorized() {
        status = 401;
        assertKind(ProviderErrorKind.AUTH);
    }

    @Test
    void serverError() {
        status = 503;
        assertKind(ProviderErrorKind.OTHER);
    }

    @Test
    void malformedJson() {
        body = "{not json";
        assertKind(ProviderErrorKind.PARSE);
    }

    @Test
    @DisplayName("Unreachable provider maps to NETWORK")
    void unreachable() {
        HttpMetadataClient client = client("");
        server.stop(0);

        assertThatThrownBy(() -> client.fetchTrack(1L))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ProviderErrorKind.NETWORK));
    }

    private void assertKind(ProviderErrorKind kind) {
        assertThatThrownBy(() -> client("").fetchTrack(1L))
                .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.getKind()).isEqualTo(kind));
    }
}
