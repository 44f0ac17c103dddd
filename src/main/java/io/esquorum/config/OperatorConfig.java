package io.esquorum.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class OperatorConfig {
    public static final String DEFAULT_APP = "elasticsearch";
    public static final String DEFAULT_CLUSTER_NAME = "elasticsearch";
    public static final int DEFAULT_SEED_SIZE = 3;
    public static final int DEFAULT_ADVERTISED_PORT = 9200;
    public static final String DEFAULT_BACKEND_SCHEME = "http";
    public static final long DEFAULT_BACKEND_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_HEALTH_INTERVAL_MS = 30_000L;
    public static final String DEFAULT_CONFIG_TEMPLATE = "templates/elasticsearch.yml";

    private final Path rootDir;
    private final String app;

    public OperatorConfig(Path rootDir, String app) {
        this.rootDir = rootDir;
        this.app = app;
    }

    public static OperatorConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_APP);
    }

    public static OperatorConfig fromRoot(String root, String app) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new OperatorConfig(resolved.toAbsolutePath().normalize(), sanitizeApp(app));
    }

    /**
     * Application names end up in DNS labels of the seed hosts, so only
     * lowercase letters, digits and single hyphens survive.
     */
    static String sanitizeApp(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_APP : raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '-';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        while (value.startsWith("-")) {
            value = value.substring(1);
        }
        while (value.endsWith("-")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isBlank() ? DEFAULT_APP : value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String app() {
        return app;
    }

    public Path settingsFile() {
        return rootDir.resolve("operator-settings.json");
    }

    public Path membershipFile() {
        return rootDir.resolve("membership.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path configRoot() {
        return rootDir.resolve("config");
    }

    public Path renderedConfigFile() {
        return configRoot().resolve("elasticsearch.yml");
    }

    /**
     * Present once the unit has been told to stop; shared by every process on this root.
     */
    public Path terminatingFile() {
        return rootDir.resolve("terminating");
    }
}
