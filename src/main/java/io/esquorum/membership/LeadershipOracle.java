package io.esquorum.membership;

/**
 * Answers whether this process currently holds leadership. Queried fresh on
 * every reconciliation pass; the answer is trusted for the rest of that pass.
 */
@FunctionalInterface
public interface LeadershipOracle {
    boolean isLeader();
}
