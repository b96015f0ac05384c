package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NeighborTable: upsert, staleness eviction, lookups and
 * the ascending iteration order.
 */
class NeighborTableTest {

    private NeighborTable table;

    @BeforeEach
    void setUp() {
        table = new NeighborTable();
    }

    private static NeighborRecord record(int id, int color, Role role, int clusterId, long lastHeardNs) {
        return new NeighborRecord(id, NetworkAddress.forNode(id), color, role, clusterId, lastHeardNs);
    }

    // =========================================================================
    // UPSERT
    // =========================================================================

    @Test
    @DisplayName("Upsert inserts a new neighbor")
    void upsert_newNeighbor_isInserted() {
        table.upsert(record(4, 1, Role.MEMBER, 2, 100));

        assertTrue(table.contains(4));
        assertEquals(1, table.size());
        assertEquals(1, table.get(4).getColor());
    }

    @Test
    @DisplayName("Upsert overwrites the previous record of the same neighbor")
    void upsert_existingNeighbor_isOverwritten() {
        table.upsert(record(4, 1, Role.MEMBER, 2, 100));
        table.upsert(record(4, 0, Role.CLUSTER_HEAD, 4, 200));

        assertEquals(1, table.size());
        NeighborRecord latest = table.get(4);
        assertEquals(0, latest.getColor());
        assertEquals(Role.CLUSTER_HEAD, latest.getRole());
        assertEquals(4, latest.getClusterId());
        assertEquals(200, latest.getLastHeardNs());
    }

    @Test
    @DisplayName("Unknown neighbor lookups return null / false")
    void lookup_unknownNeighbor() {
        assertNull(table.get(9));
        assertFalse(table.contains(9));
        assertFalse(table.isGateway(9));
        assertTrue(table.isEmpty());
    }

    // =========================================================================
    // STALENESS
    // =========================================================================

    @Test
    @DisplayName("Only neighbors silent for more than the timeout are removed")
    void removeStale_removesOnlyExpired() {
        table.upsert(record(1, 0, Role.CLUSTER_HEAD, 1, 0));
        table.upsert(record(2, 1, Role.MEMBER, 1, 1_600));
        table.upsert(record(3, 2, Role.MEMBER, 1, 2_000));

        List<Integer> removed = table.removeStale(3_500, 2_000);

        assertEquals(Arrays.asList(1), removed);
        assertFalse(table.contains(1));
        assertTrue(table.contains(2));
        assertTrue(table.contains(3));
    }

    @Test
    @DisplayName("A neighbor heard exactly timeout ago is kept")
    void removeStale_exactTimeout_isKept() {
        table.upsert(record(1, 0, Role.CLUSTER_HEAD, 1, 1_000));

        assertFalse(table.pruneStale(3_000, 2_000));
        assertTrue(table.contains(1));

        assertTrue(table.pruneStale(3_001, 2_000));
        assertFalse(table.contains(1));
    }

    @Test
    @DisplayName("Pruning an empty table removes nothing")
    void pruneStale_emptyTable() {
        assertFalse(table.pruneStale(1_000_000, 1));
        assertTrue(table.removeStale(1_000_000, 1).isEmpty());
    }

    // =========================================================================
    // LOOKUPS AND ORDER
    // =========================================================================

    @Test
    @DisplayName("Snapshot iterates in ascending identifier order")
    void snapshot_isAscending() {
        table.upsert(record(7, 1, Role.MEMBER, 0, 0));
        table.upsert(record(2, 2, Role.MEMBER, 0, 0));
        table.upsert(record(5, 0, Role.CLUSTER_HEAD, 5, 0));

        List<Integer> ids = new ArrayList<>();
        for (NeighborRecord r : table.snapshot()) {
            ids.add(r.getNeighborId());
        }
        assertEquals(Arrays.asList(2, 5, 7), ids);
    }

    @Test
    @DisplayName("Snapshot is read-only")
    void snapshot_isUnmodifiable() {
        table.upsert(record(1, 0, Role.CLUSTER_HEAD, 1, 0));
        assertThrows(UnsupportedOperationException.class, () -> table.snapshot().clear());
    }

    @Test
    @DisplayName("Gateway identifiers are listed in ascending order")
    void gatewayIds_ascending() {
        table.upsert(record(9, 2, Role.GATEWAY, 0, 0));
        table.upsert(record(3, 1, Role.GATEWAY, 0, 0));
        table.upsert(record(4, 3, Role.MEMBER, 0, 0));

        assertEquals(Arrays.asList(3, 9), table.getGatewayIds());
        assertTrue(table.isGateway(3));
        assertFalse(table.isGateway(4));
    }

    @Test
    @DisplayName("A neighbor is found by its transport address")
    void findByAddress() {
        table.upsert(record(6, 1, Role.MEMBER, 0, 0));

        assertEquals(6, table.findByAddress(NetworkAddress.forNode(6)).getNeighborId());
        assertNull(table.findByAddress(NetworkAddress.forNode(7)));
    }

}
