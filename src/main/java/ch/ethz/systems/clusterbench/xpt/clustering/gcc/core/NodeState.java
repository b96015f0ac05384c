package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

/**
 * Protocol state of a single node. Owned and mutated exclusively by that
 * node's own handlers.
 */
public class NodeState {

    public static final int UNASSIGNED_COLOR = -1;
    public static final int NO_CLUSTER = -1;

    private final int id;
    private int color;
    private Role role;
    private int clusterId;
    private int sequenceCounter;

    public NodeState(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("Node identifier must be non-negative: " + id);
        }
        this.id = id;
        this.color = UNASSIGNED_COLOR;
        this.role = Role.UNDECIDED;
        this.clusterId = NO_CLUSTER;
        this.sequenceCounter = 0;
    }

    /**
     * Apply the outcome of a role resolution (including a possible color reset).
     *
     * @param assignment    Resolved role, cluster and color
     *
     * @return True iff the role changed
     */
    public boolean apply(RoleAssignment assignment) {
        Role oldRole = this.role;
        this.role = assignment.getRole();
        this.clusterId = assignment.getClusterId();
        this.color = assignment.getColor();
        return oldRole != this.role;
    }

    /**
     * @return Sequence number for the next originated data unit
     */
    public int nextSequenceNumber() {
        return sequenceCounter++;
    }

    public int getId() {
        return id;
    }

    public int getColor() {
        return color;
    }

    public void setColor(int color) {
        if (color < UNASSIGNED_COLOR) {
            throw new IllegalArgumentException("Invalid color: " + color);
        }
        this.color = color;
    }

    public boolean isColored() {
        return color != UNASSIGNED_COLOR;
    }

    public Role getRole() {
        return role;
    }

    public int getClusterId() {
        return clusterId;
    }

    public int getSequenceCounter() {
        return sequenceCounter;
    }

    @Override
    public String toString() {
        return "NodeState{id=" + id + ", color=" + color + ", role=" + role + ", clusterId=" + clusterId + "}";
    }

}
