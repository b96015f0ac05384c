package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RoleResolver and the role state machine.
 */
class RoleResolverTest {

    private RoleResolver resolver;
    private NeighborTable table;

    @BeforeEach
    void setUp() {
        resolver = new RoleResolver();
        table = new NeighborTable();
    }

    private void neighbor(int id, int color, Role role, int clusterId) {
        table.upsert(new NeighborRecord(id, NetworkAddress.forNode(id), color, role, clusterId, 0));
    }

    @Test
    @DisplayName("An uncolored node is Undecided without cluster")
    void uncolored_isUndecided() {
        neighbor(1, 0, Role.CLUSTER_HEAD, 1);

        RoleAssignment assignment = resolver.resolve(5, NodeState.UNASSIGNED_COLOR, table);

        assertEquals(Role.UNDECIDED, assignment.getRole());
        assertEquals(NodeState.NO_CLUSTER, assignment.getClusterId());
        assertFalse(assignment.isDemotion());
    }

    @Test
    @DisplayName("Color 0 makes a node Cluster Head of its own cluster")
    void colorZero_isClusterHead() {
        neighbor(1, 1, Role.MEMBER, 9);

        RoleAssignment assignment = resolver.resolve(5, 0, table);

        assertEquals(Role.CLUSTER_HEAD, assignment.getRole());
        assertEquals(5, assignment.getClusterId());
        assertEquals(0, assignment.getColor());
    }

    @Test
    @DisplayName("A node hearing only its own cluster is a Member")
    void onlyOwnCluster_isMember() {
        neighbor(2, 0, Role.CLUSTER_HEAD, 2);
        neighbor(6, 2, Role.MEMBER, 2);

        RoleAssignment assignment = resolver.resolve(5, 1, table);

        assertEquals(Role.MEMBER, assignment.getRole());
        assertEquals(2, assignment.getClusterId());
        assertEquals(1, assignment.getColor());
    }

    @Test
    @DisplayName("A node hearing another cluster is a Gateway")
    void foreignCluster_isGateway() {
        neighbor(2, 0, Role.CLUSTER_HEAD, 2);
        neighbor(8, 2, Role.MEMBER, 7);

        RoleAssignment assignment = resolver.resolve(5, 1, table);

        assertEquals(Role.GATEWAY, assignment.getRole());
        assertEquals(2, assignment.getClusterId());
    }

    @Test
    @DisplayName("Undecided neighbors do not make a node a Gateway")
    void undecidedNeighbor_doesNotMakeGateway() {
        neighbor(2, 0, Role.CLUSTER_HEAD, 2);
        neighbor(8, NodeState.UNASSIGNED_COLOR, Role.UNDECIDED, NodeState.NO_CLUSTER);

        assertEquals(Role.MEMBER, resolver.resolve(5, 1, table).getRole());
    }

    @Test
    @DisplayName("With two visible Cluster Heads the smaller identifier is chosen")
    void twoClusterHeads_smallestIdWins() {
        neighbor(9, 0, Role.CLUSTER_HEAD, 9);
        neighbor(3, 0, Role.CLUSTER_HEAD, 3);

        RoleAssignment assignment = resolver.resolve(5, 1, table);

        assertEquals(3, assignment.getClusterId());
        // Cluster Head 9 belongs to another cluster
        assertEquals(Role.GATEWAY, assignment.getRole());
        assertEquals(3, resolver.findClusterHead(table));
    }

    @Test
    @DisplayName("A colored non-head without visible Cluster Head is demoted to Undecided")
    void noClusterHead_demotes() {
        neighbor(2, 1, Role.MEMBER, 0);

        RoleAssignment assignment = resolver.resolve(5, 2, table);

        assertTrue(assignment.isDemotion());
        assertEquals(Role.UNDECIDED, assignment.getRole());
        assertEquals(NodeState.UNASSIGNED_COLOR, assignment.getColor());
        assertEquals(NodeState.NO_CLUSTER, assignment.getClusterId());
    }

    @Test
    @DisplayName("Resolution is idempotent")
    void resolve_isIdempotent() {
        neighbor(2, 0, Role.CLUSTER_HEAD, 2);
        neighbor(8, 2, Role.GATEWAY, 4);

        NodeState state = new NodeState(5);
        state.setColor(1);
        state.apply(resolver.resolve(5, state.getColor(), table));
        RoleAssignment first = resolver.resolve(5, state.getColor(), table);
        assertFalse(state.apply(first));
        assertEquals(first, resolver.resolve(5, state.getColor(), table));
    }

    @Test
    @DisplayName("Applying a demotion resets the color of the node state")
    void applyDemotion_resetsColor() {
        NodeState state = new NodeState(5);
        state.setColor(2);

        state.apply(resolver.resolve(5, 2, table));

        assertFalse(state.isColored());
        assertEquals(Role.UNDECIDED, state.getRole());
    }

}
