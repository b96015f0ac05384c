package ch.ethz.systems.clusterbench.core.network;

/**
 * IPv4-style transport address. Node addresses live in 10.0.0.0/8,
 * group addresses in 224.0.0.0/4.
 */
public final class NetworkAddress {

    /**
     * Group every node joins: used for advertisements and backbone flooding.
     */
    public static final NetworkAddress ALL_NODES = new NetworkAddress((224 << 24) | 1);

    private final int value;

    private NetworkAddress(int value) {
        this.value = value;
    }

    /**
     * Deterministic unicast address of a node.
     *
     * @param nodeId    Node identifier (0 to 2^24 - 2)
     *
     * @return Address 10.x.y.z with x.y.z = nodeId + 1
     */
    public static NetworkAddress forNode(int nodeId) {
        if (nodeId < 0 || nodeId >= 0xFFFFFF) {
            throw new IllegalArgumentException("Node identifier out of address range: " + nodeId);
        }
        return new NetworkAddress((10 << 24) | (nodeId + 1));
    }

    public boolean isMulticast() {
        return ((value >>> 28) & 0xF) == 0xE;
    }

    public int getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkAddress)) return false;
        return value == ((NetworkAddress) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return ((value >>> 24) & 0xFF) + "." + ((value >>> 16) & 0xFF) + "."
                + ((value >>> 8) & 0xFF) + "." + (value & 0xFF);
    }

}
