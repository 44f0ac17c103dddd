package io.esquorum.membership;

/**
 * Orchestrator's view of the peer group this unit belongs to.
 */
public interface MembershipSource {
    /**
     * Number of peer units, not counting this one.
     */
    int peerCount();

    String selfIdentity();

    /**
     * Address the backend cluster is reachable on, or {@code null} when the
     * orchestrator has not published one yet.
     */
    String ingressAddress();
}
