package com.example.tagsync.repository;

import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.TrackTags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of {@link TrackStore}.
 * Batch reads use a single IN clause; writes update only the columns that have a value and
 * commit tags and artwork together.
 */
@Repository
@Slf4j
public class JdbcTrackStore implements TrackStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;
    private final TransactionTemplate transactionTemplate;

    public JdbcTrackStore(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader,
                          PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Map<String, LocalTrack> loadBatch(Collection<String> trackIds) {
        if (trackIds.isEmpty()) return Map.of();

        log.debug("Batch loading {} tracks", trackIds.size());
        String sql = sqlLoader.load("loadTracksBatch");
        MapSqlParameterSource params = new MapSqlParameterSource("trackIds", List.copyOf(trackIds));

        return jdbcTemplate.query(sql, params, rs -> {
            Map<String, LocalTrack> result = new HashMap<>();
            while (rs.next()) {
                LocalTrack track = mapTrack(rs);
                result.put(track.id(), track);
            }
            return result;
        });
    }

    @Override
    public void persist(String trackId, TrackTags tags, byte[] artwork) {
        List<String> assignments = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource("trackId", trackId);

        addAssignment(assignments, params, "title", tags.title());
        addAssignment(assignments, params, "artist", tags.artist());
        addAssignment(assignments, params, "bpm", tags.bpm());
        addAssignment(assignments, params, "musical_key", tags.key());
        addAssignment(assignments, params, "genre", tags.genre());
        addAssignment(assignments, params, "album", tags.album());
        addAssignment(assignments, params, "release_year", tags.year());
        addAssignment(assignments, params, "label", tags.label());
        addAssignment(assignments, params, "isrc", tags.isrc());
        addAssignment(assignments, params, "catalog_number", tags.catalogNumber());
        addAssignment(assignments, params, "provider_track_id", tags.providerTrackId());

        boolean withArtwork = artwork != null && artwork.length > 0;
        transactionTemplate.executeWithoutResult(status -> {
            if (!assignments.isEmpty()) {
                String sql = String.format(sqlLoader.load("updateTrackTags"), String.join(", ", assignments));
                int updated = jdbcTemplate.update(sql, params);
                if (updated == 0) {
                    throw new EmptyResultDataAccessException("Track " + trackId + " no longer exists", 1);
                }
            }
            if (withArtwork) {
                upsertArtwork(trackId, artwork, tags.artworkUrl());
            }
        });
        log.debug("Persisted {} tag fields for track {} (artwork: {})", assignments.size(), trackId, withArtwork);
    }

    @Override
    public void persistArtwork(String trackId, byte[] artwork, String sourceUrl) {
        if (artwork == null || artwork.length == 0) {
            throw new IllegalArgumentException("Artwork for track " + trackId + " is empty");
        }
        upsertArtwork(trackId, artwork, sourceUrl);
        log.debug("Persisted {} bytes of artwork for track {}", artwork.length, trackId);
    }

    /**
     * Stored artwork for a track, if any.
     */
    public Optional<byte[]> findArtwork(String trackId) {
        List<byte[]> rows = jdbcTemplate.query(sqlLoader.load("findArtwork"),
                new MapSqlParameterSource("trackId", trackId),
                (rs, rowNum) -> rs.getBytes("data"));
        return rows.stream().findFirst();
    }

    private void upsertArtwork(String trackId, byte[] artwork, String sourceUrl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("trackId", trackId)
                .addValue("data", artwork)
                .addValue("sourceUrl", sourceUrl);
        jdbcTemplate.update(sqlLoader.load("upsertArtwork"), params);
    }

    private static void addAssignment(List<String> assignments, MapSqlParameterSource params,
                                      String column, Object value) {
        if (value != null) {
            assignments.add(column + " = :" + column);
            params.addValue(column, value);
        }
    }

    private static LocalTrack mapTrack(ResultSet rs) throws SQLException {
        return new LocalTrack(
                rs.getString("id"),
                rs.getString("path"),
                rs.getString("title"),
                rs.getString("artist"),
                rs.getString("album"),
                rs.getString("genre"),
                rs.getObject("release_year", Integer.class),
                rs.getDouble("duration"),
                rs.getObject("bpm", Double.class),
                rs.getString("musical_key"),
                rs.getString("label"),
                rs.getString("isrc"),
                rs.getObject("provider_track_id", Long.class)
        );
    }
}
