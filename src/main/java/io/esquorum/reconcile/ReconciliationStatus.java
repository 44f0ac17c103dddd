package io.esquorum.reconcile;

public enum ReconciliationStatus {
    CONVERGED("converged"),
    WAITING_FOR_MEMBERS("waiting_for_members"),
    DEGRADED("degraded");

    private final String label;

    ReconciliationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
