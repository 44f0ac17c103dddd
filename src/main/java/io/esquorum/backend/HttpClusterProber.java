package io.esquorum.backend;

import com.fasterxml.jackson.databind.JsonNode;
import io.esquorum.config.OperatorSettings;
import io.esquorum.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * {@link ClusterProber} over the Elasticsearch REST management API.
 */
public final class HttpClusterProber implements ClusterProber {
    public static final String QUORUM_SETTING = "discovery.zen.minimum_master_nodes";

    private static final Logger LOG = LoggerFactory.getLogger(HttpClusterProber.class);

    private final Supplier<String> ingressAddress;
    private final String scheme;
    private final int port;
    private final Duration timeout;
    private final String authorization;
    private final HttpClient http;

    public HttpClusterProber(Supplier<String> ingressAddress, OperatorSettings settings) {
        this.ingressAddress = ingressAddress;
        this.scheme = settings.backendScheme();
        this.port = settings.advertisedPort();
        this.timeout = Duration.ofMillis(settings.backendTimeoutMs());
        this.authorization = settings.hasCredentials()
                ? "Basic " + Base64.getEncoder().encodeToString(
                (settings.backendUsername() + ":" + settings.backendPassword()).getBytes(StandardCharsets.UTF_8))
                : null;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public OptionalInt totalLiveNodes() {
        try {
            JsonNode health = get("/_cluster/health", null);
            JsonNode nodes = health.path("number_of_nodes");
            if (!nodes.canConvertToInt() || nodes.asInt() < 0) {
                LOG.warn("Cluster health response has no usable number_of_nodes");
                return OptionalInt.empty();
            }
            return OptionalInt.of(nodes.asInt());
        } catch (BackendException e) {
            LOG.warn("Live node count unavailable: {}", e.getMessage());
            return OptionalInt.empty();
        }
    }

    @Override
    public OptionalInt currentQuorumSetting() {
        JsonNode settings;
        try {
            settings = get("/_cluster/settings", "flat_settings=true");
        } catch (BackendException e) {
            LOG.warn("Quorum setting unavailable: {}", e.getMessage());
            return OptionalInt.empty();
        }
        JsonNode value = settings.path("persistent").path(QUORUM_SETTING);
        if (value.isMissingNode() || value.isNull()) {
            value = settings.path("transient").path(QUORUM_SETTING);
        }
        if (value.isMissingNode() || value.isNull()) {
            LOG.warn("{} is not set on the cluster, assuming 1", QUORUM_SETTING);
            return OptionalInt.of(1);
        }
        OptionalInt parsed = parsePositiveInt(value);
        if (parsed.isEmpty()) {
            LOG.warn("Unparseable {} value: {}", QUORUM_SETTING, value);
        }
        return parsed;
    }

    @Override
    public ApplyResult applyQuorumSetting(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("quorum setting must be >= 1: " + value);
        }
        String body = Jsons.toCompactJson(Map.of("persistent", Map.of(QUORUM_SETTING, value)));
        try {
            JsonNode response = send("/_cluster/settings", null, "PUT", body);
            if (!response.path("acknowledged").asBoolean(false)) {
                return ApplyResult.fail(value, "settings update not acknowledged");
            }
            return ApplyResult.ok(value);
        } catch (BackendException e) {
            LOG.warn("Failed to apply {}={}: {}", QUORUM_SETTING, value, e.getMessage());
            return ApplyResult.fail(value, e.getMessage());
        }
    }

    /**
     * IPv6 literals are bracketed in the authority.
     */
    URI endpoint(String path, String query) throws BackendException {
        String address = ingressAddress.get();
        if (address == null || address.isBlank()) {
            throw new BackendException("no ingress address known yet");
        }
        String host = address.trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        try {
            return new URI(scheme, null, host, port, path, query, null);
        } catch (URISyntaxException e) {
            throw new BackendException("invalid ingress address '" + address + "': " + e.getMessage(), e);
        }
    }

    private JsonNode get(String path, String query) throws BackendException {
        return send(path, query, "GET", null);
    }

    private JsonNode send(String path, String query, String method, String body) throws BackendException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(endpoint(path, query))
                    .timeout(timeout)
                    .header("Accept", "application/json");
        } catch (IllegalArgumentException e) {
            throw new BackendException(method + " " + path + " has an unusable URI: " + e.getMessage(), e);
        }
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            throw new BackendException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(method + " " + path + " interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new BackendException(method + " " + path + " failed status=" + response.statusCode());
        }
        try {
            JsonNode node = Jsons.mapper().readTree(response.body());
            if (node == null || !node.isObject()) {
                throw new BackendException(method + " " + path + " returned a non-object body");
            }
            return node;
        } catch (IOException e) {
            throw new BackendException(method + " " + path + " returned malformed JSON", e);
        }
    }

    private static OptionalInt parsePositiveInt(JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.asInt() >= 1 ? OptionalInt.of(value.asInt()) : OptionalInt.empty();
        }
        if (value.isTextual()) {
            try {
                int parsed = Integer.parseInt(value.asText().trim());
                return parsed >= 1 ? OptionalInt.of(parsed) : OptionalInt.empty();
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    static final class BackendException extends Exception {
        BackendException(String message) {
            super(message);
        }

        BackendException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
