package io.esquorum.membership;

import java.util.ArrayList;
import java.util.List;

/**
 * Leader-owned seed host list and last observed ingress address.
 *
 * <p>Seed identities are derived from their ordinal alone, so every replica
 * computes the same list without talking to the cluster. The list only grows,
 * and never past the configured seed size.
 */
public final class MembershipStore {
    private final String app;
    private final int seedSize;
    private final LeadershipOracle leadership;
    private final List<SeedHost> seeds;
    private String ingressAddress;

    public MembershipStore(String app, int seedSize, LeadershipOracle leadership) {
        if (app == null || app.isBlank()) {
            throw new IllegalArgumentException("app cannot be empty");
        }
        if (seedSize < 1) {
            throw new IllegalArgumentException("seedSize must be >= 1: " + seedSize);
        }
        this.app = app;
        this.seedSize = seedSize;
        this.leadership = leadership;
        this.seeds = new ArrayList<>(seedSize);
    }

    public static String seedHostAt(String app, int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0: " + ordinal);
        }
        return app + "-" + ordinal + "." + app + "-endpoints";
    }

    public String seedHostAt(int ordinal) {
        return seedHostAt(app, ordinal);
    }

    public int seedSize() {
        return seedSize;
    }

    public synchronized List<SeedHost> currentSeeds() {
        return List.copyOf(seeds);
    }

    public synchronized List<String> currentSeedHosts() {
        List<String> out = new ArrayList<>(seeds.size());
        for (SeedHost seed : seeds) {
            out.add(seed.host());
        }
        return out;
    }

    public synchronized boolean bootstrapComplete() {
        return seeds.size() >= seedSize;
    }

    /**
     * Tops the seed list up to the seed size. Followers never touch it.
     *
     * @return number of seeds appended by this call
     */
    public synchronized int onPeerJoined() {
        if (!leadership.isLeader()) {
            return 0;
        }
        int added = 0;
        while (seeds.size() < seedSize) {
            int ordinal = seeds.size();
            seeds.add(new SeedHost(ordinal, seedHostAt(ordinal)));
            added++;
        }
        return added;
    }

    public synchronized void recordIngressAddress(String address) {
        if (address == null || address.isBlank() || !leadership.isLeader()) {
            return;
        }
        ingressAddress = address.trim();
    }

    public synchronized String ingressAddress() {
        return ingressAddress;
    }
}
