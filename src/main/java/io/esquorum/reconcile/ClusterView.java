package io.esquorum.reconcile;

import java.util.List;

/**
 * What one pass observed. Backend values are {@code null} when they could not
 * be read or were not needed.
 */
public record ClusterView(Integer totalNodes, Integer quorumSetting, List<String> seeds) {
    public ClusterView {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
    }
}
