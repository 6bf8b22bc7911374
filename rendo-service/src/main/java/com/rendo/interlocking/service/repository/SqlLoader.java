/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.service.repository;

import com.rendo.interlocking.api.exceptions.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility for loading SQL queries from resource files.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = LoggerFactory.getLogger(SqlLoader.class);

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Load all SQL queries from a resource file.
     *
     * @param resourcePath path to SQL file (e.g., "sql/queries.sql")
     * @return map of query names to SQL strings, without trailing semicolons
     * @throws RegistryException if the resource is missing or unreadable
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();

        try (BufferedReader reader = open(resourcePath)) {
            String line;
            String currentQueryName = null;
            StringBuilder currentQuery = new StringBuilder();

            while ((line = reader.readLine()) != null) {
                line = line.trim();

                if (line.startsWith(NAME_MARKER)) {
                    putQuery(queries, currentQueryName, currentQuery);
                    currentQueryName = line.substring(NAME_MARKER.length()).trim();
                    currentQuery = new StringBuilder();
                } else if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                } else if (currentQueryName != null) {
                    if (currentQuery.length() > 0) {
                        currentQuery.append(' ');
                    }
                    currentQuery.append(line);
                }
            }
            putQuery(queries, currentQueryName, currentQuery);

            logger.info("Loaded {} SQL queries from {}", queries.size(), resourcePath);
        } catch (IOException e) {
            throw new RegistryException("Failed to load SQL queries from " + resourcePath, e);
        }

        return queries;
    }

    /**
     * Load a schema file as individual statements.
     *
     * @param resourcePath path to SQL file (e.g., "sql/schema.sql")
     * @return statements in file order, without comments and trailing semicolons
     * @throws RegistryException if the resource is missing or unreadable
     */
    public static List<String> loadSchema(String resourcePath) {
        StringBuilder schema = new StringBuilder();
        try (BufferedReader reader = open(resourcePath)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.trim().startsWith("--")) {
                    continue;
                }
                schema.append(line).append('\n');
            }
        } catch (IOException e) {
            throw new RegistryException("Failed to load SQL schema from " + resourcePath, e);
        }

        List<String> statements = new ArrayList<>();
        for (String statement : schema.toString().split(";")) {
            String sql = statement.trim();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        logger.info("Loaded {} schema statements from {}", statements.size(), resourcePath);
        return statements;
    }

    private static BufferedReader open(String resourcePath) throws IOException {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IOException("Resource not found: " + resourcePath);
        }
        return new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    private static void putQuery(Map<String, String> queries, String name, StringBuilder query) {
        if (name == null || query.length() == 0) {
            return;
        }
        String sql = query.toString().trim();
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        queries.put(name, sql);
    }
}
