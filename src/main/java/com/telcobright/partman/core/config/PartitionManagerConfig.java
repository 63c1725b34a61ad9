package com.telcobright.partman.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Settings for the partition manager process.
 * <p>
 * Loaded from {@code partition-manager.properties} on the classpath; environment
 * variables override individual keys (e.g. {@code PARTITION_ENABLED} overrides
 * {@code partition.enabled}).
 */
public class PartitionManagerConfig {

    private static final Logger logger = LoggerFactory.getLogger(PartitionManagerConfig.class);

    public static final String RESOURCE_NAME = "partition-manager.properties";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Map<String, String> ENV_OVERRIDES = Map.ofEntries(
        Map.entry("partition.enabled", "PARTITION_ENABLED"),
        Map.entry("partition.cron", "PARTITION_CRON"),
        Map.entry("partition.timezoneOffsetMs", "PARTITION_TIMEZONE_OFFSET_MS"),
        Map.entry("partition.tables", "PARTITION_CONFIG"),
        Map.entry("partition.tickSeconds", "PARTITION_TICK_SECONDS"),
        Map.entry("partition.retryIntervalMinutes", "PARTITION_RETRY_INTERVAL_MINUTES"),
        Map.entry("partition.workerThreads", "PARTITION_WORKER_THREADS"),
        Map.entry("partition.migration.sourceColumn", "PARTITION_SOURCE_COLUMN"),
        Map.entry("database.host", "DATABASE_HOST"),
        Map.entry("database.port", "DATABASE_PORT"),
        Map.entry("database.user", "DATABASE_USER"),
        Map.entry("database.password", "DATABASE_PASSWORD"),
        Map.entry("database.name", "DATABASE_NAME"),
        Map.entry("mongo.uri", "MONGO_URI"),
        Map.entry("mongo.database", "MONGO_DATABASE"));

    private final boolean enabled;
    private final String cronSchedule;
    private final LocalTime scheduledTime;
    private final long timezoneOffsetMs;
    private final List<PartitionTableConfig> tables;
    private final Duration tickInterval;
    private final Duration retryInterval;
    private final int workerThreads;
    private final String migrationSourceColumn;
    private final DataSourceConfig dataSourceConfig;
    private final String mongoUri;
    private final String mongoDatabase;

    private PartitionManagerConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.cronSchedule = builder.cronSchedule;
        this.scheduledTime = parseDailyCron(builder.cronSchedule);
        this.timezoneOffsetMs = builder.timezoneOffsetMs;
        this.tables = Collections.unmodifiableList(new ArrayList<>(builder.tables));
        this.tickInterval = builder.tickInterval;
        this.retryInterval = builder.retryInterval;
        this.workerThreads = builder.workerThreads;
        this.migrationSourceColumn = builder.migrationSourceColumn;
        this.dataSourceConfig = builder.dataSourceConfig;
        this.mongoUri = builder.mongoUri;
        this.mongoDatabase = builder.mongoDatabase;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load from the classpath resource, overridden by the process environment.
     */
    public static PartitionManagerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = PartitionManagerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info("{} not found on classpath, using defaults and environment", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties, System.getenv());
    }

    public static PartitionManagerConfig fromProperties(Properties properties, Map<String, String> environment) {
        Properties merged = new Properties();
        merged.putAll(properties);
        ENV_OVERRIDES.forEach((key, envName) -> {
            String value = environment.get(envName);
            if (value != null) {
                merged.setProperty(key, value);
            }
        });

        Builder builder = builder()
            .enabled(Boolean.parseBoolean(merged.getProperty("partition.enabled", "false")))
            .cronSchedule(merged.getProperty("partition.cron", "0 2 * * *"))
            .timezoneOffsetMs(Long.parseLong(merged.getProperty("partition.timezoneOffsetMs", "28800000")))
            .tables(parseTables(merged.getProperty("partition.tables", "[]")))
            .tickInterval(Duration.ofSeconds(Long.parseLong(merged.getProperty("partition.tickSeconds", "60"))))
            .retryInterval(Duration.ofMinutes(Long.parseLong(merged.getProperty("partition.retryIntervalMinutes", "120"))))
            .workerThreads(Integer.parseInt(merged.getProperty("partition.workerThreads", "4")))
            .migrationSourceColumn(merged.getProperty("partition.migration.sourceColumn", "updatedDate"))
            .mongoUri(merged.getProperty("mongo.uri", "mongodb://localhost:27017"))
            .mongoDatabase(merged.getProperty("mongo.database", "partition_manager"));

        builder.dataSourceConfig(DataSourceConfig.create(
            merged.getProperty("database.host", "localhost"),
            Integer.parseInt(merged.getProperty("database.port", "3306")),
            merged.getProperty("database.name", "partition_db"),
            merged.getProperty("database.user", "root"),
            merged.getProperty("database.password", "")));

        return builder.build();
    }

    /**
     * Parses the static table list. Malformed JSON yields an empty list rather than a startup failure.
     */
    static List<PartitionTableConfig> parseTables(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<PartitionTableConfig> tables = OBJECT_MAPPER.readValue(json, new TypeReference<List<PartitionTableConfig>>() { });
            return tables != null ? tables : List.of();
        } catch (JsonProcessingException e) {
            logger.warn("Invalid PARTITION_CONFIG JSON, using empty table list: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    /**
     * Accepts only the daily form {@code M H * * *} with numeric minute and hour.
     */
    static LocalTime parseDailyCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5 || !"*".equals(fields[2]) || !"*".equals(fields[3]) || !"*".equals(fields[4])) {
            throw new IllegalArgumentException("Only daily cron expressions 'M H * * *' are supported: " + expression);
        }
        try {
            int minute = Integer.parseInt(fields[0]);
            int hour = Integer.parseInt(fields[1]);
            return LocalTime.of(hour, minute);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid minute/hour in cron expression: " + expression, e);
        }
    }

    public boolean isEnabled() { return enabled; }
    public String getCronSchedule() { return cronSchedule; }

    /**
     * Time of day derived from the cron expression; default run time for statically configured tables.
     */
    public LocalTime getScheduledTime() { return scheduledTime; }
    public long getTimezoneOffsetMs() { return timezoneOffsetMs; }
    public List<PartitionTableConfig> getTables() { return tables; }
    public Duration getTickInterval() { return tickInterval; }
    public Duration getRetryInterval() { return retryInterval; }
    public int getWorkerThreads() { return workerThreads; }
    public String getMigrationSourceColumn() { return migrationSourceColumn; }
    public DataSourceConfig getDataSourceConfig() { return dataSourceConfig; }
    public String getMongoUri() { return mongoUri; }
    public String getMongoDatabase() { return mongoDatabase; }

    public static class Builder {
        private boolean enabled = false;
        private String cronSchedule = "0 2 * * *";
        private long timezoneOffsetMs = 8 * 60 * 60 * 1000L;
        private List<PartitionTableConfig> tables = List.of();
        private Duration tickInterval = Duration.ofMinutes(1);
        private Duration retryInterval = Duration.ofHours(2);
        private int workerThreads = 4;
        private String migrationSourceColumn = "updatedDate";
        private DataSourceConfig dataSourceConfig;
        private String mongoUri = "mongodb://localhost:27017";
        private String mongoDatabase = "partition_manager";

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder cronSchedule(String cronSchedule) {
            this.cronSchedule = cronSchedule;
            return this;
        }

        public Builder timezoneOffsetMs(long timezoneOffsetMs) {
            this.timezoneOffsetMs = timezoneOffsetMs;
            return this;
        }

        public Builder tables(List<PartitionTableConfig> tables) {
            this.tables = tables;
            return this;
        }

        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder retryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder migrationSourceColumn(String migrationSourceColumn) {
            this.migrationSourceColumn = migrationSourceColumn;
            return this;
        }

        public Builder dataSourceConfig(DataSourceConfig dataSourceConfig) {
            this.dataSourceConfig = dataSourceConfig;
            return this;
        }

        public Builder mongoUri(String mongoUri) {
            this.mongoUri = mongoUri;
            return this;
        }

        public Builder mongoDatabase(String mongoDatabase) {
            this.mongoDatabase = mongoDatabase;
            return this;
        }

        public PartitionManagerConfig build() {
            if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
                throw new IllegalArgumentException("Tick interval must be positive");
            }
            if (retryInterval == null || retryInterval.isZero() || retryInterval.isNegative()) {
                throw new IllegalArgumentException("Retry interval must be positive");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("At least one worker thread is required");
            }
            if (Math.abs(timezoneOffsetMs) > 18 * 60 * 60 * 1000L) {
                throw new IllegalArgumentException("Timezone offset must be within +/-18 hours");
            }
            if (tables == null) {
                tables = List.of();
            }
            return new PartitionManagerConfig(this);
        }
    }
}
