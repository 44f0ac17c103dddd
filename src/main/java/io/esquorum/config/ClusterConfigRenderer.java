package io.esquorum.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.esquorum.reconcile.Reconfigurer;
import io.esquorum.reconcile.StructuralConfig;
import io.esquorum.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes {@code elasticsearch.yml} from a static template. Only the cluster
 * name and the unicast seed host list are substituted.
 */
public final class ClusterConfigRenderer implements Reconfigurer {
    private final String template;
    private final Path output;

    public ClusterConfigRenderer(String template, Path output) {
        this.template = template == null || template.isBlank()
                ? OperatorConfig.DEFAULT_CONFIG_TEMPLATE
                : template.trim();
        this.output = output;
    }

    @Override
    public void reconfigure(StructuralConfig config) throws IOException {
        String rendered = render(config);
        Files.createDirectories(output.getParent());
        Path tmp = Files.createTempFile(output.getParent(), "elasticsearch-", ".yml.tmp");
        try {
            Files.writeString(tmp, rendered, StandardCharsets.UTF_8);
            Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public String render(StructuralConfig config) throws IOException {
        JsonNode parsed = Jsons.yaml().readTree(loadTemplate());
        ObjectNode root = parsed instanceof ObjectNode
                ? (ObjectNode) parsed
                : Jsons.yaml().createObjectNode();
        child(root, "cluster").put("name", config.clusterName());
        ObjectNode ping = child(child(child(root, "discovery"), "zen"), "ping");
        ArrayNode hosts = child(ping, "unicast").putArray("hosts");
        for (String host : config.seedHosts()) {
            hosts.add(host);
        }
        return Jsons.yaml().writeValueAsString(root);
    }

    public Path output() {
        return output;
    }

    private String loadTemplate() throws IOException {
        Path path = Paths.get(template);
        if (Files.isRegularFile(path)) {
            return Files.readString(path, StandardCharsets.UTF_8);
        }
        try (InputStream in = ClusterConfigRenderer.class.getClassLoader().getResourceAsStream(template)) {
            if (in == null) {
                throw new IOException("Config template not found: " + template);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static ObjectNode child(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        if (existing instanceof ObjectNode) {
            return (ObjectNode) existing;
        }
        return parent.putObject(name);
    }
}
