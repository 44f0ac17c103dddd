package io.esquorum.backend;

import java.util.OptionalInt;

/**
 * Read and write access to the live backend cluster.
 *
 * <p>Implementations never throw for backend trouble. An empty result means the
 * backend could not be read and the caller must skip the pass without
 * mutating anything.
 */
public interface ClusterProber {
    /**
     * Nodes the backend itself currently counts as members.
     */
    OptionalInt totalLiveNodes();

    /**
     * Current minimum master nodes setting. A backend that has no value for
     * the setting reads as {@code 1}.
     */
    OptionalInt currentQuorumSetting();

    /**
     * Persists a new minimum master nodes value. Applying the same value again
     * is harmless, so failed calls can simply be retried on a later pass.
     */
    ApplyResult applyQuorumSetting(int value);
}
