package com.example.tagsync.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine cache for downloaded artwork.
 *
 * Tracks from the same release share one cover image, so an apply batch over an album
 * downloads it once. Keyed by artwork URL.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.artwork.max-size:500}")
    private int artworkMaxSize;

    @Value("${app.cache.artwork.ttl-minutes:30}")
    private int artworkTtlMinutes;

    @Bean
    public Cache<String, byte[]> artworkCache() {
        log.info("Creating artwork cache: maxSize={}, ttl={}m", artworkMaxSize, artworkTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(artworkMaxSize)
                .expireAfterWrite(Duration.ofMinutes(artworkTtlMinutes))
                .recordStats()
                .build();
    }
}
