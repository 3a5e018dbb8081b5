package com.example.tagsync.repository;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Scanner;

/**
 * Loads named SQL statements from classpath:sql/queries.sql.
 * A statement starts at a "-- name: xyz" line and runs until the next marker.
 */
@Component
public class SqlTemplateLoader {

    static final String QUERIES_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private volatile Map<String, String> queries;

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public String load(String name) {
        String query = queries().get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in queries.sql: " + name);
        }
        return query;
    }

    private Map<String, String> queries() {
        Map<String, String> loaded = queries;
        if (loaded == null) {
            synchronized (this) {
                loaded = queries;
                if (loaded == null) {
                    loaded = parse(resourceLoader.getResource(QUERIES_LOCATION));
                    queries = loaded;
                }
            }
        }
        return loaded;
    }

    private static Map<String, String> parse(Resource resource) {
        Map<String, String> parsed = new HashMap<>();
        try (InputStream in = resource.getInputStream();
             Scanner scanner = new Scanner(in, StandardCharsets.UTF_8.name())) {
            String currentName = null;
            StringBuilder body = new StringBuilder();
            while (scanner.hasNextLine()) {
                String line = scanner.nextLine();
                String trimmed = line.trim();
                if (trimmed.startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        parsed.put(currentName, body.toString().trim());
                    }
                    currentName = trimmed.substring(NAME_MARKER.length()).trim();
                    body = new StringBuilder();
                } else if (currentName != null && !trimmed.startsWith("--")) {
                    body.append(line).append('\n');
                }
            }
            if (currentName != null) {
                parsed.put(currentName, body.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL statements from " + QUERIES_LOCATION, e);
        }
        return Collections.unmodifiableMap(parsed);
    }
}
