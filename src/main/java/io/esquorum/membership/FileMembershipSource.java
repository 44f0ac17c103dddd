package io.esquorum.membership;

import com.fasterxml.jackson.databind.JsonNode;
import io.esquorum.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Membership and leadership as published by the lifecycle layer in
 * {@code membership.json}. {@link #refresh()} takes one snapshot per pass so
 * that leadership and peer count stay consistent for the whole pass.
 */
public final class FileMembershipSource implements MembershipSource, LeadershipOracle {
    private static final Logger LOG = LoggerFactory.getLogger(FileMembershipSource.class);

    private final Path file;
    private final String defaultUnit;
    private volatile Snapshot snapshot;

    public FileMembershipSource(Path file, String defaultUnit) {
        this.file = file;
        this.defaultUnit = defaultUnit == null || defaultUnit.isBlank() ? "unit-0" : defaultUnit.trim();
        this.snapshot = Snapshot.alone(this.defaultUnit);
    }

    public Snapshot refresh() {
        Snapshot next = load();
        snapshot = next;
        return next;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    @Override
    public boolean isLeader() {
        return snapshot.leader();
    }

    @Override
    public int peerCount() {
        return snapshot.peerCount();
    }

    @Override
    public String selfIdentity() {
        return snapshot.unit();
    }

    @Override
    public String ingressAddress() {
        return snapshot.ingressAddress();
    }

    private Snapshot load() {
        if (!Files.exists(file)) {
            return Snapshot.alone(defaultUnit);
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            List<String> peers = new ArrayList<>();
            for (JsonNode peer : node.path("peers")) {
                String value = peer.asText("").trim();
                if (!value.isBlank()) {
                    peers.add(value);
                }
            }
            int peerCount = node.hasNonNull("peerCount")
                    ? node.path("peerCount").asInt(peers.size())
                    : peers.size();
            if (peerCount < 0) {
                LOG.warn("Ignoring membership file {} with negative peerCount {}", file, peerCount);
                return Snapshot.alone(defaultUnit);
            }
            String ingress = node.path("ingressAddress").asText("").trim();
            return new Snapshot(
                    node.path("unit").asText(defaultUnit),
                    node.path("leader").asBoolean(false),
                    peerCount,
                    List.copyOf(peers),
                    ingress.isBlank() ? null : ingress
            );
        } catch (Exception e) {
            // Unreadable membership is treated as a non-leader alone, which never writes.
            LOG.warn("Ignoring unreadable membership file {}: {}", file, e.getMessage());
            return Snapshot.alone(defaultUnit);
        }
    }

    public record Snapshot(String unit, boolean leader, int peerCount, List<String> peers, String ingressAddress) {
        static Snapshot alone(String unit) {
            return new Snapshot(unit, false, 0, List.of(), null);
        }
    }
}
