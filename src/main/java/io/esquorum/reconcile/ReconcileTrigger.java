package io.esquorum.reconcile;

import java.util.Locale;

public enum ReconcileTrigger {
    PEER_JOINED,
    PEER_CHANGED,
    HEALTH_TICK,
    CONFIG_CHANGED;

    public static ReconcileTrigger fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return HEALTH_TICK;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ReconcileTrigger value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown trigger: " + raw);
    }
}
