package io.esquorum.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.esquorum.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public record OperatorSettings(
        String clusterName,
        int seedSize,
        int advertisedPort,
        String backendScheme,
        long backendTimeoutMs,
        long healthIntervalMs,
        String backendUsername,
        String backendPassword,
        String configTemplate
) {
    public static OperatorSettings defaults() {
        return new OperatorSettings(
                OperatorConfig.DEFAULT_CLUSTER_NAME,
                OperatorConfig.DEFAULT_SEED_SIZE,
                OperatorConfig.DEFAULT_ADVERTISED_PORT,
                OperatorConfig.DEFAULT_BACKEND_SCHEME,
                OperatorConfig.DEFAULT_BACKEND_TIMEOUT_MS,
                OperatorConfig.DEFAULT_HEALTH_INTERVAL_MS,
                "",
                "",
                ""
        );
    }

    /**
     * Reads {@code operator-settings.json}. A missing file yields the defaults;
     * fields absent from the file keep their default value.
     */
    public static OperatorSettings load(Path file) {
        OperatorSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load operator settings: " + file, e);
        }
    }

    static OperatorSettings fromFile(SettingsFile file, OperatorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new OperatorSettings(
                sanitizeString(file.clusterName(), defaults.clusterName()),
                sanitizeInt(file.seedSize(), defaults.seedSize(), 1, Integer.MAX_VALUE),
                sanitizeInt(file.advertisedPort(), defaults.advertisedPort(), 1, 65_535),
                sanitizeScheme(file.backendScheme(), defaults.backendScheme()),
                sanitizeLong(file.backendTimeoutMs(), defaults.backendTimeoutMs(), 100L),
                sanitizeLong(file.healthIntervalMs(), defaults.healthIntervalMs(), 1_000L),
                sanitizeSecret(file.backendUsername(), defaults.backendUsername()),
                sanitizeSecret(file.backendPassword(), defaults.backendPassword()),
                sanitizeSecret(file.configTemplate(), defaults.configTemplate())
        );
    }

    public OperatorSettings withSeedSize(int value) {
        return new OperatorSettings(clusterName, Math.max(1, value), advertisedPort, backendScheme,
                backendTimeoutMs, healthIntervalMs, backendUsername, backendPassword, configTemplate);
    }

    public OperatorSettings withClusterName(String value) {
        return new OperatorSettings(sanitizeString(value, clusterName), seedSize, advertisedPort, backendScheme,
                backendTimeoutMs, healthIntervalMs, backendUsername, backendPassword, configTemplate);
    }

    public boolean hasCredentials() {
        return !backendUsername.isBlank();
    }

    public View toView() {
        return new View(
                clusterName,
                seedSize,
                advertisedPort,
                backendScheme,
                backendTimeoutMs,
                healthIntervalMs,
                hasCredentials(),
                configTemplate.isBlank() ? OperatorConfig.DEFAULT_CONFIG_TEMPLATE : configTemplate
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min, int max) {
        if (raw == null) {
            return fallback;
        }
        return Math.min(max, Math.max(min, raw));
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeString(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static String sanitizeSecret(String raw, String fallback) {
        if (raw == null) {
            return fallback == null ? "" : fallback;
        }
        return raw.trim();
    }

    private static String sanitizeScheme(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (!"http".equals(value) && !"https".equals(value)) {
            throw new IllegalArgumentException("Unsupported backend scheme: " + raw);
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String clusterName,
            Integer seedSize,
            Integer advertisedPort,
            String backendScheme,
            Long backendTimeoutMs,
            Long healthIntervalMs,
            String backendUsername,
            String backendPassword,
            String configTemplate
    ) {
    }

    public record View(
            String clusterName,
            int seedSize,
            int advertisedPort,
            String backendScheme,
            long backendTimeoutMs,
            long healthIntervalMs,
            boolean backendCredentialsSet,
            String configTemplate
    ) {
    }
}
