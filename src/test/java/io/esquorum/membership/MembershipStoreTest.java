package io.esquorum.membership;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MembershipStoreTest {
    @Test
    void seedHostAtShouldBeDeterministic() {
        MembershipStore store = new MembershipStore("es", 3, () -> true);
        assertEquals("es-0.es-endpoints", store.seedHostAt(0));
        assertEquals("es-2.es-endpoints", store.seedHostAt(2));
        for (int i = 0; i < 10; i++) {
            assertEquals(store.seedHostAt(i), store.seedHostAt(i));
            assertEquals(store.seedHostAt(i), MembershipStore.seedHostAt("es", i));
        }
        assertThrows(IllegalArgumentException.class, () -> store.seedHostAt(-1));
    }

    @Test
    void leaderTopsUpToSeedSizeFromOrdinals() {
        MembershipStore store = new MembershipStore("es", 3, () -> true);
        assertTrue(store.currentSeeds().isEmpty());
        assertFalse(store.bootstrapComplete());

        assertEquals(3, store.onPeerJoined());
        assertTrue(store.bootstrapComplete());
        assertEquals(List.of("es-0.es-endpoints", "es-1.es-endpoints", "es-2.es-endpoints"), store.currentSeedHosts());
        for (SeedHost seed : store.currentSeeds()) {
            assertEquals(store.seedHostAt(seed.ordinal()), seed.host());
        }
    }

    @Test
    void seedListNeverShrinksNorExceedsSeedSize() {
        AtomicBoolean leader = new AtomicBoolean(false);
        MembershipStore store = new MembershipStore("es", 4, leader::get);
        int previous = 0;
        for (int i = 0; i < 20; i++) {
            leader.set(i % 3 != 0);
            store.onPeerJoined();
            int size = store.currentSeeds().size();
            assertTrue(size >= previous);
            assertTrue(size <= 4);
            previous = size;
        }
        assertEquals(4, previous);
        assertEquals(0, store.onPeerJoined());
    }

    @Test
    void followerCallsAreNoOps() {
        MembershipStore store = new MembershipStore("es", 3, () -> false);
        assertEquals(0, store.onPeerJoined());
        store.recordIngressAddress("10.0.0.9");
        assertTrue(store.currentSeeds().isEmpty());
        assertNull(store.ingressAddress());
    }

    @Test
    void ingressAddressKeepsLastNonBlankValue() {
        MembershipStore store = new MembershipStore("es", 3, () -> true);
        store.recordIngressAddress(" 10.0.0.5 ");
        store.recordIngressAddress("");
        store.recordIngressAddress(null);
        assertEquals("10.0.0.5", store.ingressAddress());
    }

    @Test
    void currentSeedsIsAnImmutableSnapshot() {
        MembershipStore store = new MembershipStore("es", 2, () -> true);
        List<SeedHost> before = store.currentSeeds();
        store.onPeerJoined();
        assertTrue(before.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> store.currentSeeds().clear());
    }
}
