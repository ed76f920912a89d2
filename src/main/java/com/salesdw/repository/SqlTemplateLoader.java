package com.salesdw.repository;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Scanner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads named SQL blocks from every {@code classpath:sql/*.sql} file.
 *
 * A block starts with a {@code -- name: <query>} line and runs until the next one.
 * Templates may contain {@code ${placeholder}} identifiers (table and column names only,
 * never values) which {@link #render(String, Map)} substitutes.
 */
@Component
public class SqlTemplateLoader {

    private static final String LOCATION = "classpath*:sql/*.sql";
    private static final String NAME_MARKER = "-- name:";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z]+)}");

    private final ResourcePatternResolver resourceResolver;
    private final Map<String, String> queriesCache = new HashMap<>();

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this.resourceResolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
    }

    public synchronized String load(String name) {
        if (queriesCache.isEmpty()) {
            loadAll();
        }

        String query = queriesCache.get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + LOCATION + ": " + name);
        }
        return query;
    }

    /**
     * Load a template and substitute its placeholders.
     *
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public String render(String name, Map<String, String> placeholders) {
        String template = load(name);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = placeholders.get(key);
            if (value == null) {
                throw new IllegalArgumentException("No value for placeholder '" + key + "' in query " + name);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private void loadAll() {
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(LOCATION);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list SQL files: " + LOCATION, e);
        }
        for (Resource resource : resources) {
            parse(resource);
        }
    }

    private void parse(Resource resource) {
        try (InputStream in = resource.getInputStream(); Scanner s = new Scanner(in, StandardCharsets.UTF_8.name())) {
            String currentName = null;
            StringBuilder sb = new StringBuilder();
            while (s.hasNextLine()) {
                String line = s.nextLine();
                if (line.trim().startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        queriesCache.put(currentName, sb.toString().trim());
                    }
                    currentName = line.trim().substring(NAME_MARKER.length()).trim();
                    sb = new StringBuilder();
                } else if (currentName != null) {
                    sb.append(line).append('\n');
                }
            }
            if (currentName != null) {
                queriesCache.put(currentName, sb.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL file: " + resource.getDescription(), e);
        }
    }
}
