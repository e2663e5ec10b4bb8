package com.example.salary.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Loads named SQL statements from a single file.
 *
 * Each statement starts with a {@code -- name: <queryName>} line and runs until the next
 * marker or the end of the file. Lines before the first marker are ignored.
 */
@Component
@Slf4j
public class SqlTemplateLoader {

    static final String DEFAULT_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final String location;
    private Map<String, String> queries;

    @Autowired
    public SqlTemplateLoader(
            ResourceLoader resourceLoader,
            @Value("${app.db.queries-location:" + DEFAULT_LOCATION + "}") String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this(resourceLoader, DEFAULT_LOCATION);
    }

    public String load(String name) {
        String query = queries().get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + location + ": " + name);
        }
        return query;
    }

    public Set<String> names() {
        return queries().keySet();
    }

    private synchronized Map<String, String> queries() {
        if (queries == null) {
            queries = parse(resourceLoader.getResource(location));
            log.debug("Loaded {} named queries from {}", queries.size(), location);
        }
        return queries;
    }

    private Map<String, String> parse(Resource resource) {
        Map<String, String> parsed = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String currentName = null;
            StringBuilder sql = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        parsed.put(currentName, sql.toString().trim());
                    }
                    currentName = trimmed.substring(NAME_MARKER.length()).trim();
                    sql.setLength(0);
                } else if (currentName != null) {
                    sql.append(line).append('\n');
                }
            }
            if (currentName != null) {
                parsed.put(currentName, sql.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries file: " + location, e);
        }
        return Map.copyOf(parsed);
    }
}
