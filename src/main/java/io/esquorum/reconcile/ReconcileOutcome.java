package io.esquorum.reconcile;

public record ReconcileOutcome(
        ReconciliationStatus status,
        ReconcileTrigger trigger,
        boolean leader,
        int expectedMembers,
        Integer idealQuorum,
        ClusterView observed,
        int seedsAdded,
        boolean reconfigured,
        boolean quorumWritten,
        String message,
        long completedAtMs
) {
}
