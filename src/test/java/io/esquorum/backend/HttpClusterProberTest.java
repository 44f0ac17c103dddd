package io.esquorum.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.esquorum.config.OperatorSettings;
import io.esquorum.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;

final class HttpClusterProberTest {
    private HttpServer server;
    private volatile int healthStatus;
    private volatile String healthBody;
    private volatile String settingsBody;
    private volatile int putStatus;
    private volatile String putResponse;
    private volatile long delayMs;
    private final List<String> putBodies = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startBackend() throws IOException {
        healthStatus = 200;
        healthBody = "{\"cluster_name\":\"es\",\"status\":\"green\",\"number_of_nodes\":3}";
        settingsBody = "{\"persistent\":{},\"transient\":{}}";
        putStatus = 200;
        putResponse = "{\"acknowledged\":true}";
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/_cluster/health", exchange -> {
            pause();
            record(exchange);
            respond(exchange, healthStatus, healthBody);
        });
        server.createContext("/_cluster/settings", exchange -> {
            pause();
            record(exchange);
            if ("PUT".equals(exchange.getRequestMethod())) {
                putBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                respond(exchange, putStatus, putResponse);
            } else {
                respond(exchange, 200, settingsBody);
            }
        });
        server.start();
    }

    @AfterEach
    void stopBackend() {
        server.stop(0);
    }

    @Test
    void liveNodeCountIsReadFromClusterHealth() {
        Assertions.assertEquals(OptionalInt.of(3), prober().totalLiveNodes());
    }

    @Test
    void missingQuorumSettingDefaultsToOne() {
        Assertions.assertEquals(OptionalInt.of(1), prober().currentQuorumSetting());
    }

    @Test
    void persistentQuorumSettingWinsOverTransient() {
        settingsBody = "{\"persistent\":{\"discovery.zen.minimum_master_nodes\":\"2\"},"
                + "\"transient\":{\"discovery.zen.minimum_master_nodes\":\"5\"}}";
        Assertions.assertEquals(OptionalInt.of(2), prober().currentQuorumSetting());

        settingsBody = "{\"persistent\":{},\"transient\":{\"discovery.zen.minimum_master_nodes\":4}}";
        Assertions.assertEquals(OptionalInt.of(4), prober().currentQuorumSetting());
    }

    @Test
    void unparseableQuorumSettingIsUnknown() {
        settingsBody = "{\"persistent\":{\"discovery.zen.minimum_master_nodes\":\"many\"}}";
        Assertions.assertTrue(prober().currentQuorumSetting().isEmpty());
    }

    @Test
    void applyWritesPersistentSetting() throws Exception {
        ApplyResult result = prober().applyQuorumSetting(4);

        Assertions.assertTrue(result.success());
        Assertions.assertEquals(4, result.value());
        Assertions.assertEquals(1, putBodies.size());
        JsonNode body = Jsons.mapper().readTree(putBodies.get(0));
        Assertions.assertEquals(4, body.path("persistent").path("discovery.zen.minimum_master_nodes").asInt());
    }

    @Test
    void applyIsFailedWhenRejectedOrNotAcknowledged() {
        putStatus = 400;
        putResponse = "{\"error\":\"illegal value\"}";
        ApplyResult rejected = prober().applyQuorumSetting(3);
        Assertions.assertFalse(rejected.success());
        Assertions.assertTrue(rejected.error().contains("status=400"));

        putStatus = 200;
        putResponse = "{\"acknowledged\":false}";
        ApplyResult unacknowledged = prober().applyQuorumSetting(3);
        Assertions.assertFalse(unacknowledged.success());
    }

    @Test
    void backendErrorsAreUnknownRatherThanThrown() {
        healthStatus = 503;
        Assertions.assertTrue(prober().totalLiveNodes().isEmpty());

        healthStatus = 200;
        healthBody = "not json";
        Assertions.assertTrue(prober().totalLiveNodes().isEmpty());

        healthBody = "{\"status\":\"red\"}";
        Assertions.assertTrue(prober().totalLiveNodes().isEmpty());
    }

    @Test
    void stalledBackendTimesOutAsUnknown() {
        delayMs = 1_500L;
        OperatorSettings settings = settingsFor(server.getAddress().getPort());
        HttpClusterProber prober = new HttpClusterProber(() -> "127.0.0.1", withTimeout(settings, 200L));
        long started = System.nanoTime();
        Assertions.assertTrue(prober.totalLiveNodes().isEmpty());
        Assertions.assertTrue((System.nanoTime() - started) / 1_000_000L < 1_400L);
    }

    @Test
    void missingIngressAddressIsUnknown() {
        HttpClusterProber prober = new HttpClusterProber(() -> null, settingsFor(server.getAddress().getPort()));
        Assertions.assertTrue(prober.totalLiveNodes().isEmpty());
        Assertions.assertTrue(prober.currentQuorumSetting().isEmpty());
        Assertions.assertFalse(prober.applyQuorumSetting(2).success());
    }

    @Test
    void unreachableBackendIsUnknown() throws IOException {
        int port;
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        HttpClusterProber prober = new HttpClusterProber(() -> "127.0.0.1", settingsFor(port));
        Assertions.assertTrue(prober.totalLiveNodes().isEmpty());
        Assertions.assertFalse(prober.applyQuorumSetting(2).success());
    }

    @Test
    void ipv6IngressAddressIsBracketed() throws Exception {
        HttpClusterProber prober = new HttpClusterProber(() -> "fd00::5", settingsFor(9200));
        Assertions.assertEquals("http://[fd00::5]:9200/_cluster/health",
                prober.endpoint("/_cluster/health", null).toString());
        Assertions.assertEquals("http://[fd00::5]:9200/_cluster/settings?flat_settings=true",
                prober.endpoint("/_cluster/settings", "flat_settings=true").toString());

        HttpClusterProber bracketed = new HttpClusterProber(() -> "[fd00::5]", settingsFor(9200));
        Assertions.assertEquals("http://[fd00::5]:9200/_cluster/health",
                bracketed.endpoint("/_cluster/health", null).toString());
    }

    @Test
    void ipv6IngressAddressWithNoListenerIsUnknown() throws IOException {
        int port;
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        HttpClusterProber prober = new HttpClusterProber(() -> "::1", withTimeout(settingsFor(port), 500L));
        Assertions.assertTrue(prober.totalLiveNodes().isEmpty());
        Assertions.assertTrue(prober.currentQuorumSetting().isEmpty());
        Assertions.assertFalse(prober.applyQuorumSetting(2).success());
    }

    @Test
    void malformedIngressAddressIsUnknown() {
        HttpClusterProber prober = new HttpClusterProber(() -> "es host", settingsFor(server.getAddress().getPort()));
        Assertions.assertTrue(prober.totalLiveNodes().isEmpty());
        Assertions.assertTrue(prober.currentQuorumSetting().isEmpty());
        ApplyResult result = prober.applyQuorumSetting(2);
        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().contains("invalid ingress address"));
    }

    @Test
    void basicCredentialsAreSentWhenConfigured() {
        OperatorSettings base = settingsFor(server.getAddress().getPort());
        OperatorSettings withAuth = new OperatorSettings(
                base.clusterName(), base.seedSize(), base.advertisedPort(), base.backendScheme(),
                base.backendTimeoutMs(), base.healthIntervalMs(), "elastic", "changeme", base.configTemplate());
        new HttpClusterProber(() -> "127.0.0.1", withAuth).totalLiveNodes();
        Assertions.assertEquals(List.of("Basic ZWxhc3RpYzpjaGFuZ2VtZQ=="), authHeaders);
    }

    @Test
    void quorumBelowOneIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> prober().applyQuorumSetting(0));
    }

    private HttpClusterProber prober() {
        return new HttpClusterProber(() -> "127.0.0.1", settingsFor(server.getAddress().getPort()));
    }

    private static OperatorSettings settingsFor(int port) {
        OperatorSettings d = OperatorSettings.defaults();
        return new OperatorSettings(d.clusterName(), d.seedSize(), port, "http",
                2_000L, d.healthIntervalMs(), "", "", "");
    }

    private static OperatorSettings withTimeout(OperatorSettings s, long timeoutMs) {
        return new OperatorSettings(s.clusterName(), s.seedSize(), s.advertisedPort(), s.backendScheme(),
                timeoutMs, s.healthIntervalMs(), s.backendUsername(), s.backendPassword(), s.configTemplate());
    }

    private void pause() {
        long wait = delayMs;
        if (wait <= 0L) {
            return;
        }
        try {
            Thread.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void record(HttpExchange exchange) {
        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        if (auth != null) {
            authHeaders.add(auth);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
