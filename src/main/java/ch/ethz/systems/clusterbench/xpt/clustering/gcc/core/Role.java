package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

/**
 * Cluster role of a node. The wire code is what an advertisement carries.
 */
public enum Role {

    /**
     * No color yet, or no Cluster Head in sight.
     */
    UNDECIDED(0),

    /**
     * Holds color 0; coordinates uplink, downlink and backbone relaying of its cluster.
     */
    CLUSTER_HEAD(1),

    /**
     * Attached to exactly one Cluster Head; never relays transit traffic.
     */
    MEMBER(2),

    /**
     * Member which also hears a neighbor of another cluster; bridges between clusters.
     */
    GATEWAY(3);

    private final int wireCode;

    Role(int wireCode) {
        this.wireCode = wireCode;
    }

    public int getWireCode() {
        return wireCode;
    }

    /**
     * @return True iff the role carries inter-cluster traffic (Cluster Head or Gateway)
     */
    public boolean isBackbone() {
        return this == CLUSTER_HEAD || this == GATEWAY;
    }

    /**
     * Decode a wire code.
     *
     * @param wireCode  Code 0-3
     *
     * @return Role
     *
     * @throws IllegalArgumentException if the code is not a known role
     */
    public static Role fromWireCode(int wireCode) {
        for (Role role : values()) {
            if (role.wireCode == wireCode) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role wire code: " + wireCode);
    }

}
