package com.example.tagsync.client;

import com.example.tagsync.config.SyncMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads cover art, served from the artwork cache when the same URL was fetched recently.
 */
@Component
@Slf4j
public class HttpArtworkFetcher implements ArtworkFetcher {

    private final Cache<String, byte[]> artworkCache;
    private final SyncMetrics metrics;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpArtworkFetcher(
            Cache<String, byte[]> artworkCache,
            SyncMetrics metrics,
            @Value("${app.provider.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${app.provider.request-timeout-ms:15000}") long requestTimeoutMs) {
        this.artworkCache = artworkCache;
        this.metrics = metrics;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public byte[] download(String url) throws IOException {
        byte[] cached = artworkCache.getIfPresent(url);
        if (cached != null) {
            metrics.incrementArtworkCacheHit();
            log.debug("Artwork cache hit: {}", url);
            return cached;
        }
        metrics.incrementArtworkCacheMiss();

        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Artwork download interrupted: " + url, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Artwork download failed with HTTP " + response.statusCode() + ": " + url);
        }
        byte[] data = response.body();
        if (data == null || data.length == 0) {
            throw new IOException("Artwork download returned no data: " + url);
        }

        artworkCache.put(url, data);
        log.debug("Downloaded artwork ({} bytes): {}", data.length, url);
        return data;
    }
}
