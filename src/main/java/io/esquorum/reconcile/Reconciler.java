package io.esquorum.reconcile;

import io.esquorum.backend.ApplyResult;
import io.esquorum.backend.ClusterProber;
import io.esquorum.membership.LeadershipOracle;
import io.esquorum.membership.MembershipSource;
import io.esquorum.membership.MembershipStore;
import io.esquorum.quorum.QuorumCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Level-triggered control loop body. Every call recomputes the full picture
 * from the orchestrator, the membership store and the backend, so a failed
 * pass is simply retried by the next trigger.
 *
 * <p>Only the leader mutates anything. The quorum setting is written only when
 * the backend sees exactly as many nodes as the orchestrator reports: pushing a
 * quorum sized for members that have not joined yet can leave the cluster
 * unable to elect a master.
 */
public final class Reconciler {
    private static final Logger LOG = LoggerFactory.getLogger(Reconciler.class);

    private final MembershipSource membership;
    private final LeadershipOracle leadership;
    private final MembershipStore store;
    private final ClusterProber prober;
    private final Reconfigurer reconfigurer;
    private final String clusterName;
    private final AtomicLong passTotal;
    private final AtomicLong quorumWriteTotal;
    private final AtomicLong quorumWriteFailureTotal;
    private int renderedSeedCount;
    private volatile ReconciliationStatus status;
    private volatile ReconcileOutcome lastOutcome;

    public Reconciler(
            MembershipSource membership,
            LeadershipOracle leadership,
            MembershipStore store,
            ClusterProber prober,
            Reconfigurer reconfigurer,
            String clusterName
    ) {
        this.membership = membership;
        this.leadership = leadership;
        this.store = store;
        this.prober = prober;
        this.reconfigurer = reconfigurer;
        this.clusterName = clusterName;
        this.passTotal = new AtomicLong(0L);
        this.quorumWriteTotal = new AtomicLong(0L);
        this.quorumWriteFailureTotal = new AtomicLong(0L);
        this.renderedSeedCount = -1;
        this.status = ReconciliationStatus.WAITING_FOR_MEMBERS;
    }

    public synchronized ReconcileOutcome reconcile(ReconcileTrigger trigger) {
        int peers = membership.peerCount();
        if (peers < 0) {
            throw new IllegalStateException("negative peer count reported: " + peers);
        }
        int expected = peers + 1;
        passTotal.incrementAndGet();

        if (!leadership.isLeader()) {
            return finish(ReconciliationStatus.CONVERGED, trigger, false, expected, null,
                    null, null, 0, false, false, "follower; leader drives convergence");
        }

        store.recordIngressAddress(membership.ingressAddress());
        int seedsAdded = store.bootstrapComplete() ? 0 : store.onPeerJoined();
        if (seedsAdded > 0) {
            LOG.info("Seed hosts topped up by {} to {}", seedsAdded, store.currentSeedHosts());
        }

        boolean reconfigured = false;
        List<String> seeds = store.currentSeedHosts();
        if (seeds.size() != renderedSeedCount || trigger == ReconcileTrigger.CONFIG_CHANGED) {
            try {
                reconfigurer.reconfigure(new StructuralConfig(clusterName, seeds));
                renderedSeedCount = seeds.size();
                reconfigured = true;
            } catch (IOException | RuntimeException e) {
                LOG.warn("Structural reconfiguration failed: {}", e.getMessage());
                return finish(ReconciliationStatus.DEGRADED, trigger, true, expected, null,
                        null, null, seedsAdded, false, false,
                        "structural reconfiguration failed: " + e.getMessage());
            }
        }

        OptionalInt live = prober.totalLiveNodes();
        if (live.isEmpty()) {
            return finish(ReconciliationStatus.WAITING_FOR_MEMBERS, trigger, true, expected, null,
                    null, null, seedsAdded, reconfigured, false, "backend unreachable; live node count unknown");
        }
        if (live.getAsInt() != expected) {
            return finish(ReconciliationStatus.WAITING_FOR_MEMBERS, trigger, true, expected, null,
                    live.getAsInt(), null, seedsAdded, reconfigured, false,
                    "waiting for members: backend sees " + live.getAsInt() + " of " + expected);
        }

        int ideal = QuorumCalculator.idealQuorum(expected);
        OptionalInt current = prober.currentQuorumSetting();
        if (current.isEmpty()) {
            return finish(ReconciliationStatus.WAITING_FOR_MEMBERS, trigger, true, expected, ideal,
                    live.getAsInt(), null, seedsAdded, reconfigured, false,
                    "backend unreachable; quorum setting unknown");
        }
        if (current.getAsInt() == ideal) {
            return finish(ReconciliationStatus.CONVERGED, trigger, true, expected, ideal,
                    live.getAsInt(), current.getAsInt(), seedsAdded, reconfigured, false,
                    "converged at quorum " + ideal);
        }

        quorumWriteTotal.incrementAndGet();
        ApplyResult applied = prober.applyQuorumSetting(ideal);
        if (!applied.success()) {
            quorumWriteFailureTotal.incrementAndGet();
            LOG.warn("Quorum update {} -> {} failed: {}", current.getAsInt(), ideal, applied.error());
            return finish(ReconciliationStatus.DEGRADED, trigger, true, expected, ideal,
                    live.getAsInt(), current.getAsInt(), seedsAdded, reconfigured, true,
                    "failed to apply quorum " + ideal + ": " + applied.error());
        }
        LOG.info("Quorum updated {} -> {} for {} members", current.getAsInt(), ideal, expected);
        return finish(ReconciliationStatus.CONVERGED, trigger, true, expected, ideal,
                live.getAsInt(), current.getAsInt(), seedsAdded, reconfigured, true,
                "quorum updated " + current.getAsInt() + " -> " + ideal);
    }

    public ReconciliationStatus status() {
        return status;
    }

    public ReconcileOutcome lastOutcome() {
        return lastOutcome;
    }

    public Stats stats() {
        return new Stats(
                passTotal.get(),
                quorumWriteTotal.get(),
                quorumWriteFailureTotal.get(),
                store.currentSeeds().size(),
                store.seedSize()
        );
    }

    private ReconcileOutcome finish(
            ReconciliationStatus next,
            ReconcileTrigger trigger,
            boolean leader,
            int expected,
            Integer idealQuorum,
            Integer liveNodes,
            Integer currentQuorum,
            int seedsAdded,
            boolean reconfigured,
            boolean quorumWritten,
            String message
    ) {
        ReconcileOutcome outcome = new ReconcileOutcome(
                next,
                trigger,
                leader,
                expected,
                idealQuorum,
                new ClusterView(liveNodes, currentQuorum, leader ? store.currentSeedHosts() : List.of()),
                seedsAdded,
                reconfigured,
                quorumWritten,
                message,
                Instant.now().toEpochMilli()
        );
        status = next;
        lastOutcome = outcome;
        return outcome;
    }

    public record Stats(
            long passTotal,
            long quorumWriteTotal,
            long quorumWriteFailureTotal,
            int seedCount,
            int seedSize
    ) {
    }
}
