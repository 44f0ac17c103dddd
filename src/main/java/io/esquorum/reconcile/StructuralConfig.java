package io.esquorum.reconcile;

import java.util.List;

/**
 * The parts of the node configuration that need a rolling reconfiguration
 * rather than a live settings push.
 */
public record StructuralConfig(String clusterName, List<String> seedHosts) {
    public StructuralConfig {
        seedHosts = seedHosts == null ? List.of() : List.copyOf(seedHosts);
    }
}
