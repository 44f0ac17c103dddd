package io.esquorum.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.esquorum.reconcile.StructuralConfig;
import io.esquorum.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class ClusterConfigRendererTest {

    @Test
    void clusterNameAndSeedsAreSubstitutedIntoBundledTemplate() throws Exception {
        Path root = Files.createTempDirectory("esquorum-render-");
        Path out = root.resolve("config").resolve("elasticsearch.yml");
        ClusterConfigRenderer renderer = new ClusterConfigRenderer("", out);

        renderer.reconfigure(new StructuralConfig("new name", List.of("es-0.es-endpoints", "es-1.es-endpoints")));

        JsonNode config = Jsons.yaml().readTree(Files.readString(out, StandardCharsets.UTF_8));
        Assertions.assertEquals("new name", config.path("cluster").path("name").asText());
        JsonNode hosts = config.path("discovery").path("zen").path("ping").path("unicast").path("hosts");
        Assertions.assertEquals(2, hosts.size());
        Assertions.assertEquals("es-0.es-endpoints", hosts.get(0).asText());
        Assertions.assertEquals("0.0.0.0", config.path("network").path("host").asText());
        try (Stream<Path> files = Files.list(out.getParent())) {
            Assertions.assertEquals(1L, files.count());
        }
    }

    @Test
    void rerenderReplacesPreviousSeeds() throws Exception {
        Path root = Files.createTempDirectory("esquorum-render-again-");
        Path out = root.resolve("elasticsearch.yml");
        ClusterConfigRenderer renderer = new ClusterConfigRenderer(null, out);

        renderer.reconfigure(new StructuralConfig("es", List.of("a")));
        renderer.reconfigure(new StructuralConfig("es", List.of("a", "b", "c")));

        JsonNode config = Jsons.yaml().readTree(Files.readString(out, StandardCharsets.UTF_8));
        Assertions.assertEquals(3, config.path("discovery").path("zen").path("ping").path("unicast").path("hosts").size());
    }

    @Test
    void fileTemplateIsUsedWhenPresent() throws Exception {
        Path root = Files.createTempDirectory("esquorum-render-custom-");
        Path template = root.resolve("custom.yml");
        Files.writeString(template, "path:\n  data: /var/lib/es\n", StandardCharsets.UTF_8);
        ClusterConfigRenderer renderer = new ClusterConfigRenderer(template.toString(), root.resolve("out.yml"));

        String rendered = renderer.render(new StructuralConfig("es", List.of("es-0.es-endpoints")));
        JsonNode config = Jsons.yaml().readTree(rendered);

        Assertions.assertEquals("/var/lib/es", config.path("path").path("data").asText());
        Assertions.assertEquals("es", config.path("cluster").path("name").asText());
        Assertions.assertEquals("es-0.es-endpoints",
                config.path("discovery").path("zen").path("ping").path("unicast").path("hosts").get(0).asText());
    }

    @Test
    void missingTemplateIsAnIoFailure() throws Exception {
        Path root = Files.createTempDirectory("esquorum-render-missing-");
        ClusterConfigRenderer renderer = new ClusterConfigRenderer("templates/nope.yml", root.resolve("out.yml"));
        Assertions.assertThrows(IOException.class, () -> renderer.reconfigure(new StructuralConfig("es", List.of())));
        Assertions.assertFalse(Files.exists(root.resolve("out.yml")));
    }
}
