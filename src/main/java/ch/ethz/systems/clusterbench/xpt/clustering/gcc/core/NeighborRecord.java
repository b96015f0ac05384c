package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;

/**
 * Last observation of a neighbor, as advertised by it. Immutable: a fresher
 * advertisement replaces the whole record.
 */
public final class NeighborRecord {

    private final int neighborId;
    private final NetworkAddress address;
    private final int color;
    private final Role role;
    private final int clusterId;
    private final long lastHeardNs;

    public NeighborRecord(int neighborId, NetworkAddress address, int color, Role role, int clusterId,
                          long lastHeardNs) {
        if (role == null) {
            throw new IllegalArgumentException("Neighbor role must not be null");
        }
        this.neighborId = neighborId;
        this.address = address;
        this.color = color;
        this.role = role;
        this.clusterId = clusterId;
        this.lastHeardNs = lastHeardNs;
    }

    public int getNeighborId() {
        return neighborId;
    }

    public NetworkAddress getAddress() {
        return address;
    }

    public int getColor() {
        return color;
    }

    public Role getRole() {
        return role;
    }

    public int getClusterId() {
        return clusterId;
    }

    public long getLastHeardNs() {
        return lastHeardNs;
    }

    /**
     * @param nowNs         Current virtual time
     * @param timeoutNs     Staleness threshold
     *
     * @return True iff more than the timeout has passed since the neighbor was last heard
     */
    public boolean isStale(long nowNs, long timeoutNs) {
        return nowNs - lastHeardNs > timeoutNs;
    }

    @Override
    public String toString() {
        return "NeighborRecord{id=" + neighborId + ", address=" + address + ", color=" + color
                + ", role=" + role + ", clusterId=" + clusterId + ", lastHeard=" + lastHeardNs + "}";
    }

}
