package io.esquorum.quorum;

/**
 * Minimum master nodes for a group of a given size.
 *
 * <p>Groups of one or two members run with a quorum of one so that a lone
 * survivor of a two-node group can still elect itself. This gives up
 * split-brain protection below three members. From three members upward the
 * quorum is a strict majority.
 */
public final class QuorumCalculator {
    private QuorumCalculator() {
    }

    public static int idealQuorum(int totalMembers) {
        if (totalMembers < 1) {
            throw new IllegalArgumentException("totalMembers must be >= 1: " + totalMembers);
        }
        if (totalMembers <= 2) {
            return 1;
        }
        return totalMembers / 2 + 1;
    }
}
