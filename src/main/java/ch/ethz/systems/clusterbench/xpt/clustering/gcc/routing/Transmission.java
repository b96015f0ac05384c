package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

/**
 * One copy of a data unit towards one neighbor, and how to put it on the medium.
 */
public final class Transmission {

    public enum Delivery {

        /** Confident single unicast: sent right away. */
        IMMEDIATE_UNICAST,

        /** One of possibly several unicast copies (route cache hint, outbound bridge): sent after a random jitter. */
        DEFERRED_UNICAST,

        /** Flood copy to the all-nodes group, addressed by next hop: sent after a random jitter. */
        DEFERRED_MULTICAST
    }

    private final int targetNeighborId;
    private final Delivery delivery;

    public Transmission(int targetNeighborId, Delivery delivery) {
        this.targetNeighborId = targetNeighborId;
        this.delivery = delivery;
    }

    public int getTargetNeighborId() {
        return targetNeighborId;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public boolean isDeferred() {
        return delivery != Delivery.IMMEDIATE_UNICAST;
    }

    public boolean isMulticast() {
        return delivery == Delivery.DEFERRED_MULTICAST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transmission)) return false;
        Transmission that = (Transmission) o;
        return targetNeighborId == that.targetNeighborId && delivery == that.delivery;
    }

    @Override
    public int hashCode() {
        return 31 * targetNeighborId + delivery.hashCode();
    }

    @Override
    public String toString() {
        return delivery + "->" + targetNeighborId;
    }

}
