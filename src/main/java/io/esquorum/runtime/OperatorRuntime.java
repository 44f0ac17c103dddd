package io.esquorum.runtime;

import io.esquorum.backend.ClusterProber;
import io.esquorum.backend.HttpClusterProber;
import io.esquorum.config.ClusterConfigRenderer;
import io.esquorum.config.OperatorConfig;
import io.esquorum.config.OperatorSettings;
import io.esquorum.membership.FileMembershipSource;
import io.esquorum.membership.LeadershipOracle;
import io.esquorum.membership.MembershipSource;
import io.esquorum.membership.MembershipStore;
import io.esquorum.observability.AuditLogger;
import io.esquorum.observability.PrometheusFormatter;
import io.esquorum.reconcile.ClusterView;
import io.esquorum.reconcile.ReconcileOutcome;
import io.esquorum.reconcile.ReconcileTrigger;
import io.esquorum.reconcile.ReconciliationStatus;
import io.esquorum.reconcile.Reconciler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class OperatorRuntime {
    public static final String READY_MESSAGE = "Elasticsearch is ready";
    public static final String TERMINATING_MESSAGE = "Pod is terminating.";

    private static final Logger LOG = LoggerFactory.getLogger(OperatorRuntime.class);

    private final OperatorConfig config;
    private final OperatorSettings settings;
    private final FileMembershipSource fileMembership;
    private final MembershipSource membership;
    private final LeadershipOracle leadership;
    private final MembershipStore store;
    private final ClusterProber prober;
    private final ClusterConfigRenderer renderer;
    private final Reconciler reconciler;
    private final AuditLogger auditLogger;
    private volatile boolean terminating;
    private ReconciliationStatus lastAuditedStatus;
    private String lastAuditedMessage;

    public OperatorRuntime(OperatorConfig config) {
        this(config, OperatorSettings.load(config.settingsFile()));
    }

    public OperatorRuntime(OperatorConfig config, OperatorSettings settings) {
        this(config, settings, new FileMembershipSource(config.membershipFile(), config.app() + "-0"));
    }

    private OperatorRuntime(OperatorConfig config, OperatorSettings settings, FileMembershipSource source) {
        this(config, settings, source, source, null);
    }

    /**
     * @param prober backend access, or {@code null} for the REST API at the
     *               ingress address the leader last recorded
     */
    public OperatorRuntime(
            OperatorConfig config,
            OperatorSettings settings,
            MembershipSource membership,
            LeadershipOracle leadership,
            ClusterProber prober
    ) {
        this.config = config;
        this.settings = settings;
        this.fileMembership = membership instanceof FileMembershipSource
                ? (FileMembershipSource) membership
                : null;
        this.membership = membership;
        this.leadership = leadership;
        this.store = new MembershipStore(config.app(), settings.seedSize(), leadership);
        this.prober = prober == null
                ? new HttpClusterProber(store::ingressAddress, settings)
                : prober;
        this.renderer = new ClusterConfigRenderer(settings.configTemplate(), config.renderedConfigFile());
        this.reconciler = new Reconciler(membership, leadership, store, this.prober, renderer, settings.clusterName());
        this.auditLogger = new AuditLogger(config.auditFile(), config.app());
        this.terminating = Files.exists(config.terminatingFile());
    }

    public ReconcileOutcome onConfigChanged() {
        return handle(ReconcileTrigger.CONFIG_CHANGED);
    }

    public ReconcileOutcome onPeerJoined() {
        return handle(ReconcileTrigger.PEER_JOINED);
    }

    public ReconcileOutcome onPeerChanged() {
        return handle(ReconcileTrigger.PEER_CHANGED);
    }

    public ReconcileOutcome onHealthTick() {
        return handle(ReconcileTrigger.HEALTH_TICK);
    }

    public synchronized ReconcileOutcome handle(ReconcileTrigger trigger) {
        if (terminating()) {
            return new ReconcileOutcome(
                    reconciler.status(),
                    trigger,
                    false,
                    0,
                    null,
                    new ClusterView(null, null, List.of()),
                    0,
                    false,
                    false,
                    "unit terminating; reconciliation skipped",
                    Instant.now().toEpochMilli()
            );
        }
        if (fileMembership != null) {
            fileMembership.refresh();
        }
        ReconcileOutcome out = reconciler.reconcile(trigger);
        auditOutcome(out);
        return out;
    }

    /**
     * Marks the unit terminating for this process and, through the marker
     * file, for every other process on the same root. Audited once.
     */
    public synchronized void onStop() {
        if (terminating()) {
            return;
        }
        terminating = true;
        try {
            Files.createDirectories(config.rootDir());
            Files.writeString(config.terminatingFile(), Instant.now().toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write terminating marker: " + config.terminatingFile(), e);
        }
        LOG.info("Unit {} is terminating", membership.selfIdentity());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "unit.stop",
                "system",
                "unit/" + membership.selfIdentity(),
                "terminating",
                Map.of("last_status", reconciler.status().label())
        ));
    }

    public HealthOutcome health() {
        boolean stopping = terminating();
        ReconciliationStatus status = reconciler.status();
        ReconcileOutcome last = reconciler.lastOutcome();
        String unitState = stopping ? "maintenance" : "active";
        String message;
        if (stopping) {
            message = TERMINATING_MESSAGE;
        } else if (status == ReconciliationStatus.CONVERGED) {
            message = READY_MESSAGE;
        } else if (status == ReconciliationStatus.WAITING_FOR_MEMBERS) {
            message = "Waiting for cluster members";
        } else {
            message = "Quorum convergence failed";
        }
        return new HealthOutcome(
                !stopping && status != ReconciliationStatus.DEGRADED,
                status.label(),
                unitState,
                message,
                last == null ? null : last.message(),
                last != null && last.leader(),
                Instant.now().toString()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(reconciler.stats(), reconciler.status(), reconciler.lastOutcome(), config.app());
    }

    public List<String> seeds() {
        return store.currentSeedHosts();
    }

    public AuditLogger.VerifyOutcome verifyAudit() {
        return auditLogger.verify();
    }

    public ReconciliationStatus status() {
        return reconciler.status();
    }

    public OperatorConfig config() {
        return config;
    }

    public OperatorSettings settings() {
        return settings;
    }

    public boolean terminating() {
        if (!terminating && Files.exists(config.terminatingFile())) {
            terminating = true;
        }
        return terminating;
    }

    private void auditOutcome(ReconcileOutcome out) {
        String unit = "unit/" + membership.selfIdentity();
        if (out.seedsAdded() > 0) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "seeds.topup",
                    "leader",
                    unit,
                    "ok",
                    Map.of("added", out.seedsAdded(), "seeds", out.observed().seeds())
            ));
        }
        if (out.reconfigured()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "config.render",
                    "leader",
                    config.renderedConfigFile().toString(),
                    "ok",
                    Map.of("cluster_name", settings.clusterName(), "seeds", out.observed().seeds())
            ));
        }
        if (out.quorumWritten()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("setting", HttpClusterProber.QUORUM_SETTING);
            details.put("from", out.observed().quorumSetting());
            details.put("to", out.idealQuorum());
            details.put("expected_members", out.expectedMembers());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "quorum.apply",
                    "leader",
                    "cluster/settings",
                    out.status() == ReconciliationStatus.DEGRADED ? "failed" : "ok",
                    details
            ));
        }
        // Steady-state ticks repeat the same pass; only transitions are kept.
        if (out.status() == lastAuditedStatus && Objects.equals(out.message(), lastAuditedMessage)) {
            return;
        }
        lastAuditedStatus = out.status();
        lastAuditedMessage = out.message();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("trigger", out.trigger().name().toLowerCase(Locale.ROOT));
        details.put("leader", out.leader());
        details.put("expected_members", out.expectedMembers());
        details.put("live_nodes", out.observed().totalNodes());
        details.put("quorum_current", out.observed().quorumSetting());
        details.put("quorum_ideal", out.idealQuorum());
        details.put("message", out.message());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "reconcile.pass",
                out.leader() ? "leader" : "follower",
                unit,
                out.status().label(),
                details
        ));
    }

    public record HealthOutcome(
            boolean ok,
            String status,
            String unitState,
            String message,
            String detail,
            boolean leader,
            String checkedAt
    ) {
    }
}
