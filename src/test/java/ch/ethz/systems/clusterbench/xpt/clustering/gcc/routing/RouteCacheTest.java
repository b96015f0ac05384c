package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborRecord;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborTable;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.Role;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class RouteCacheTest {

    private RouteCache cache;
    private NeighborTable table;

    @BeforeEach
    void setUp() {
        cache = new RouteCache();
        table = new NeighborTable();
    }

    private void neighbor(int id, Role role) {
        table.upsert(new NeighborRecord(id, NetworkAddress.forNode(id), role == Role.GATEWAY ? 1 : 2, role, 0, 0));
    }

    @Test
    @DisplayName("Lookup of an unknown destination gives no route")
    void unknownDestination() {
        assertFalse(cache.contains(20));
        assertEquals(RouteCache.NO_ROUTE, cache.lookupValidGateway(20, table));
    }

    @Test
    @DisplayName("A learned route through a current Gateway is returned")
    void learnedRoute_isValid() {
        neighbor(3, Role.GATEWAY);
        cache.learn(20, 3);

        assertEquals(3, cache.lookupValidGateway(20, table));
        assertTrue(cache.contains(20));
    }

    @Test
    @DisplayName("Learning again overwrites the previous hint")
    void learn_overwrites() {
        neighbor(3, Role.GATEWAY);
        neighbor(4, Role.GATEWAY);
        cache.learn(20, 3);
        cache.learn(20, 4);

        assertEquals(1, cache.size());
        assertEquals(4, cache.lookupValidGateway(20, table));
    }

    @Test
    @DisplayName("A route whose Gateway is no longer a Gateway is evicted on lookup")
    void gatewayDemoted_evicts() {
        neighbor(3, Role.GATEWAY);
        cache.learn(20, 3);
        neighbor(3, Role.MEMBER);

        assertEquals(RouteCache.NO_ROUTE, cache.lookupValidGateway(20, table));
        assertFalse(cache.contains(20));
    }

    @Test
    @DisplayName("A route whose Gateway left the table is evicted on lookup")
    void gatewayGone_evicts() {
        cache.learn(20, 3);

        assertEquals(RouteCache.NO_ROUTE, cache.lookupValidGateway(20, table));
        assertEquals(0, cache.size());
    }

}
