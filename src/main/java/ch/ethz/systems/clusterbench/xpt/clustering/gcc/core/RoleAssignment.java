package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

/**
 * Result of a role resolution: role, cluster and the color the node must
 * hold afterwards. The color differs from the input color only for an
 * Undecided demotion.
 */
public final class RoleAssignment {

    private final Role role;
    private final int clusterId;
    private final int color;
    private final boolean demoted;

    private RoleAssignment(Role role, int clusterId, int color, boolean demoted) {
        this.role = role;
        this.clusterId = clusterId;
        this.color = color;
        this.demoted = demoted;
    }

    static RoleAssignment undecided() {
        return new RoleAssignment(Role.UNDECIDED, NodeState.NO_CLUSTER, NodeState.UNASSIGNED_COLOR, false);
    }

    /**
     * Undecided demotion: a colored node which sees no Cluster Head drops
     * its color and becomes Undecided, so that it recolors from scratch.
     */
    static RoleAssignment undecidedDemotion() {
        return new RoleAssignment(Role.UNDECIDED, NodeState.NO_CLUSTER, NodeState.UNASSIGNED_COLOR, true);
    }

    static RoleAssignment clusterHead(int nodeId) {
        return new RoleAssignment(Role.CLUSTER_HEAD, nodeId, ColoringEngine.CLUSTER_HEAD_COLOR, false);
    }

    static RoleAssignment attached(Role role, int clusterHeadId, int color) {
        return new RoleAssignment(role, clusterHeadId, color, false);
    }

    public Role getRole() {
        return role;
    }

    public int getClusterId() {
        return clusterId;
    }

    public int getColor() {
        return color;
    }

    /**
     * @return True iff this assignment is an Undecided demotion (color reset)
     */
    public boolean isDemotion() {
        return demoted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleAssignment)) return false;
        RoleAssignment that = (RoleAssignment) o;
        return clusterId == that.clusterId && color == that.color && demoted == that.demoted && role == that.role;
    }

    @Override
    public int hashCode() {
        int result = role.hashCode();
        result = 31 * result + clusterId;
        result = 31 * result + color;
        result = 31 * result + (demoted ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "RoleAssignment{role=" + role + ", clusterId=" + clusterId + ", color=" + color
                + (demoted ? ", demoted" : "") + "}";
    }

}
