package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

/**
 * Derives role and cluster of a node from its own color and its neighbor table.
 *
 * State machine over {UNDECIDED, CLUSTER_HEAD, MEMBER, GATEWAY}:
 * <ul>
 *     <li>uncolored: UNDECIDED, no cluster</li>
 *     <li>color 0: CLUSTER_HEAD of its own cluster</li>
 *     <li>other color, a color-0 neighbor exists: attached to the color-0 neighbor with
 *     the smallest identifier; GATEWAY if any neighbor reports another cluster,
 *     MEMBER otherwise</li>
 *     <li>other color, no color-0 neighbor: Undecided demotion (color is reset)</li>
 * </ul>
 * Only 1-hop Cluster Heads are ever chosen. Resolution is idempotent.
 */
public class RoleResolver {

    /**
     * Resolve the role of a node.
     *
     * @param nodeId    Identifier of the node
     * @param color     Current color of the node
     * @param table     Neighbor table of the node
     *
     * @return Role assignment to apply
     */
    public RoleAssignment resolve(int nodeId, int color, NeighborTable table) {

        if (color == NodeState.UNASSIGNED_COLOR) {
            return RoleAssignment.undecided();
        }

        if (color == ColoringEngine.CLUSTER_HEAD_COLOR) {
            return RoleAssignment.clusterHead(nodeId);
        }

        int clusterHeadId = findClusterHead(table);
        if (clusterHeadId == NodeState.NO_CLUSTER) {
            return RoleAssignment.undecidedDemotion();
        }

        Role role = hearsForeignCluster(clusterHeadId, table) ? Role.GATEWAY : Role.MEMBER;
        return RoleAssignment.attached(role, clusterHeadId, color);
    }

    /**
     * @return Smallest identifier of a color-0 neighbor, or {@link NodeState#NO_CLUSTER}
     */
    int findClusterHead(NeighborTable table) {
        for (NeighborRecord record : table.snapshot()) {
            if (record.getColor() == ColoringEngine.CLUSTER_HEAD_COLOR) {
                return record.getNeighborId();
            }
        }
        return NodeState.NO_CLUSTER;
    }

    // Neighbors without a cluster (Undecided) do not make a node a Gateway
    private static boolean hearsForeignCluster(int ownClusterId, NeighborTable table) {
        for (NeighborRecord record : table.snapshot()) {
            if (record.getClusterId() != NodeState.NO_CLUSTER && record.getClusterId() != ownClusterId) {
                return true;
            }
        }
        return false;
    }

}
