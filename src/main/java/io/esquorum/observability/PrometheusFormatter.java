package io.esquorum.observability;

import io.esquorum.reconcile.ReconcileOutcome;
import io.esquorum.reconcile.ReconciliationStatus;
import io.esquorum.reconcile.Reconciler;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(Reconciler.Stats stats, ReconciliationStatus status, ReconcileOutcome last, String app) {
        StringBuilder sb = new StringBuilder();
        for (ReconciliationStatus value : ReconciliationStatus.values()) {
            appendGauge(sb, "esquorum_reconcile_status", "Current reconciliation status (1=active)",
                    "status", value.label(), value == status ? 1L : 0L);
        }
        appendGauge(sb, "esquorum_reconcile_passes_total", "Reconciliation passes run", null, null, stats.passTotal());
        appendGauge(sb, "esquorum_quorum_writes_total", "Quorum setting writes attempted", null, null, stats.quorumWriteTotal());
        appendGauge(sb, "esquorum_quorum_write_failures_total", "Quorum setting writes that failed", null, null, stats.quorumWriteFailureTotal());
        appendGauge(sb, "esquorum_seed_hosts", "Seed hosts known to this unit", null, null, stats.seedCount());
        appendGauge(sb, "esquorum_seed_size", "Configured seed group size", null, null, stats.seedSize());
        if (last != null) {
            appendGauge(sb, "esquorum_leader", "Whether this unit led the last pass (1=yes,0=no)", null, null, last.leader() ? 1L : 0L);
            appendGauge(sb, "esquorum_expected_members", "Members reported by the orchestrator, self included", null, null, last.expectedMembers());
            appendOptional(sb, "esquorum_live_nodes", "Nodes the backend reported in the last pass", last.observed().totalNodes());
            appendOptional(sb, "esquorum_quorum_current", "Quorum setting read in the last pass", last.observed().quorumSetting());
            appendOptional(sb, "esquorum_quorum_ideal", "Quorum computed for the expected members", last.idealQuorum());
        }
        String base = sb.toString();
        String normalizedApp = app == null ? "" : app.trim();
        if (normalizedApp.isBlank()) {
            return base;
        }
        StringBuilder withApp = new StringBuilder(base.length() + 128);
        withApp.append(base);
        withApp.append("# HELP esquorum_app_info Operator application marker\n");
        withApp.append("# TYPE esquorum_app_info gauge\n");
        withApp.append("esquorum_app_info{app=\"").append(escapeLabel(normalizedApp)).append("\"} 1\n");
        return withApp.toString();
    }

    private static void appendOptional(StringBuilder sb, String metric, String help, Integer value) {
        if (value != null) {
            appendGauge(sb, metric, help, null, null, value);
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
