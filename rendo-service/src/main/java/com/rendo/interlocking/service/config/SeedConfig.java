/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.service.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Configuration of a seeding run.
 *
 * <p>Values are resolved in three layers, later layers winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>{@code seed.properties} (classpath first, then file system)</li>
 *   <li>environment variables ({@code SEED_DATA_DIR}, {@code SEED_REGISTRY_TYPE},
 *       {@code SEED_JDBC_URL}, {@code SEED_JDBC_USER}, {@code SEED_JDBC_PASSWORD},
 *       {@code SEED_JDBC_POOL_SIZE})</li>
 * </ol>
 *
 * <p>Station adjacency overrides are read from {@code adjacency.<stationId>=A,B} keys and
 * merged over the compiler's built-in table.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SeedConfig config = SeedConfig.loadDefault();
 *
 * SeedConfig custom = SeedConfig.builder()
 *     .dataDirectory(Path.of("/srv/rendo"))
 *     .registryType(RegistryType.JDBC)
 *     .jdbcUrl("jdbc:postgresql://db/rendo")
 *     .build();
 * }</pre>
 */
public final class SeedConfig {

    private static final Logger logger = LoggerFactory.getLogger(SeedConfig.class);

    public static final String DEFAULT_PROPERTIES = "seed.properties";

    private static final String ENV_DATA_DIR = "SEED_DATA_DIR";
    private static final String ENV_REGISTRY_TYPE = "SEED_REGISTRY_TYPE";
    private static final String ENV_JDBC_URL = "SEED_JDBC_URL";
    private static final String ENV_JDBC_USER = "SEED_JDBC_USER";
    private static final String ENV_JDBC_PASSWORD = "SEED_JDBC_PASSWORD";
    private static final String ENV_JDBC_POOL_SIZE = "SEED_JDBC_POOL_SIZE";

    private static final String ADJACENCY_PREFIX = "adjacency.";

    /**
     * Where compiled records are written.
     */
    public enum RegistryType {
        /** In-process registry, discarded when the run ends */
        MEMORY,

        /** JDBC registry (H2 or PostgreSQL) behind a HikariCP pool */
        JDBC
    }

    private final Path dataDirectory;
    private final RegistryType registryType;
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final int jdbcPoolSize;
    private final Map<String, List<String>> adjacencyOverrides;

    private SeedConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.registryType = builder.registryType;
        this.jdbcUrl = builder.jdbcUrl;
        this.jdbcUser = builder.jdbcUser;
        this.jdbcPassword = builder.jdbcPassword;
        this.jdbcPoolSize = builder.jdbcPoolSize;
        this.adjacencyOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(builder.adjacencyOverrides));

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static SeedConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    public static SeedConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    /**
     * Load properties from the classpath or file system, then apply environment overrides
     * looked up through {@code environment}.
     */
    public static SeedConfig loadFromProperties(String propertiesPath, UnaryOperator<String> environment) {
        logger.info("Loading seed configuration from: {}", propertiesPath);

        Properties props = new Properties();

        try (InputStream is = SeedConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.debug("Could not load from classpath: {}", propertiesPath, e);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.warn("Could not load properties file: {}. Using defaults.", propertiesPath);
            }
        }

        return builder()
                .properties(props)
                .environment(environment)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {

        private Path dataDirectory = Paths.get("data");
        private RegistryType registryType = RegistryType.MEMORY;
        private String jdbcUrl = "jdbc:h2:mem:rendo;DB_CLOSE_DELAY=-1";
        private String jdbcUser = "sa";
        private String jdbcPassword = "";
        private int jdbcPoolSize = 4;
        private final Map<String, List<String>> adjacencyOverrides = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        public Builder registryType(RegistryType registryType) {
            this.registryType = registryType;
            return this;
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder jdbcUser(String jdbcUser) {
            this.jdbcUser = jdbcUser;
            return this;
        }

        public Builder jdbcPassword(String jdbcPassword) {
            this.jdbcPassword = jdbcPassword;
            return this;
        }

        public Builder jdbcPoolSize(int jdbcPoolSize) {
            this.jdbcPoolSize = jdbcPoolSize;
            return this;
        }

        public Builder adjacency(String stationId, List<String> adjacent) {
            this.adjacencyOverrides.put(stationId, List.copyOf(adjacent));
            return this;
        }

        /**
         * Apply {@code seed.*} and {@code adjacency.*} keys.
         */
        public Builder properties(Properties props) {
            String dataDir = props.getProperty("seed.data.dir");
            if (dataDir != null) {
                this.dataDirectory = Paths.get(dataDir.trim());
            }

            String type = props.getProperty("seed.registry.type");
            if (type != null) {
                parseRegistryType(type, "seed.registry.type").ifPresent(val -> this.registryType = val);
            }

            String url = props.getProperty("seed.jdbc.url");
            if (url != null) {
                this.jdbcUrl = url.trim();
            }

            String user = props.getProperty("seed.jdbc.user");
            if (user != null) {
                this.jdbcUser = user.trim();
            }

            String password = props.getProperty("seed.jdbc.password");
            if (password != null) {
                this.jdbcPassword = password;
            }

            String poolSize = props.getProperty("seed.jdbc.pool.size");
            if (poolSize != null) {
                parseInt(poolSize, "seed.jdbc.pool.size").ifPresent(val -> this.jdbcPoolSize = val);
            }

            props.stringPropertyNames().stream()
                    .filter(key -> key.startsWith(ADJACENCY_PREFIX))
                    .sorted()
                    .forEach(key -> adjacency(key.substring(ADJACENCY_PREFIX.length()),
                            parseStationList(props.getProperty(key))));
            return this;
        }

        /**
         * Apply {@code SEED_*} overrides found through {@code environment}.
         */
        public Builder environment(UnaryOperator<String> environment) {
            getEnv(environment, ENV_DATA_DIR).ifPresent(val -> this.dataDirectory = Paths.get(val));
            getEnv(environment, ENV_REGISTRY_TYPE)
                    .flatMap(val -> parseRegistryType(val, ENV_REGISTRY_TYPE))
                    .ifPresent(val -> this.registryType = val);
            getEnv(environment, ENV_JDBC_URL).ifPresent(val -> this.jdbcUrl = val);
            getEnv(environment, ENV_JDBC_USER).ifPresent(val -> this.jdbcUser = val);
            getEnv(environment, ENV_JDBC_PASSWORD).ifPresent(val -> this.jdbcPassword = val);
            getEnv(environment, ENV_JDBC_POOL_SIZE)
                    .flatMap(val -> parseInt(val, ENV_JDBC_POOL_SIZE))
                    .ifPresent(val -> this.jdbcPoolSize = val);
            return this;
        }

        public SeedConfig build() {
            return new SeedConfig(this);
        }

        private static Optional<String> getEnv(UnaryOperator<String> environment, String key) {
            String value = environment.apply(key);
            if (value != null && !value.isBlank()) {
                logger.debug("Loaded env var: {}={}", key, maskSensitive(key, value));
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<RegistryType> parseRegistryType(String value, String key) {
            try {
                return Optional.of(RegistryType.valueOf(value.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {}: {}, keeping current registry type", key, value);
                return Optional.empty();
            }
        }

        private static Optional<Integer> parseInt(String value, String key) {
            try {
                return Optional.of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Invalid int value for {}: {}", key, value);
                return Optional.empty();
            }
        }

        private static List<String> parseStationList(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toUnmodifiableList());
        }

        private static String maskSensitive(String key, String value) {
            if (key.contains("PASSWORD") || key.contains("SECRET")) {
                return "***REDACTED***";
            }
            return value;
        }
    }

    private void validate() {
        if (dataDirectory == null) {
            throw new IllegalArgumentException("dataDirectory must be set");
        }
        if (registryType == null) {
            throw new IllegalArgumentException("registryType must be set");
        }
        if (registryType == RegistryType.JDBC) {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalArgumentException("jdbcUrl is required for the JDBC registry");
            }
            if (jdbcPoolSize <= 0) {
                throw new IllegalArgumentException("jdbcPoolSize must be positive: " + jdbcPoolSize);
            }
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public RegistryType getRegistryType() {
        return registryType;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public int getJdbcPoolSize() {
        return jdbcPoolSize;
    }

    public Map<String, List<String>> getAdjacencyOverrides() {
        return adjacencyOverrides;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SeedConfig{");
        sb.append("dataDirectory=").append(dataDirectory);
        sb.append(", registryType=").append(registryType);
        if (registryType == RegistryType.JDBC) {
            sb.append(", jdbcUrl=").append(jdbcUrl);
            sb.append(", jdbcUser=").append(jdbcUser);
            sb.append(", jdbcPassword=").append(jdbcPassword == null || jdbcPassword.isEmpty() ? "" : "***");
            sb.append(", jdbcPoolSize=").append(jdbcPoolSize);
        }
        if (!adjacencyOverrides.isEmpty()) {
            sb.append(", adjacencyOverrides=").append(adjacencyOverrides);
        }
        sb.append('}');
        return sb.toString();
    }
}
