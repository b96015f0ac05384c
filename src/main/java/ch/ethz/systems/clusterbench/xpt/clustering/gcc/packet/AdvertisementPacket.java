package ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet;

import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.Role;

/**
 * Periodic advertisement of a node's local state, sent to the all-nodes group.
 */
public class AdvertisementPacket extends GccPacket {

    // senderId, color, role, clusterId: 4 x 32 bit
    private static final long HEADER_SIZE_BIT = 4 * 32;

    // Filler so that the transport never sees an empty body
    public static final int FILLER_SIZE_BYTE = 1;

    private final int senderId;
    private final int color;
    private final Role role;
    private final int clusterId;

    public AdvertisementPacket(int senderId, int color, Role role, int clusterId) {
        super(HEADER_SIZE_BIT + FILLER_SIZE_BYTE * 8L);
        if (role == null) {
            throw new IllegalArgumentException("Advertised role must not be null");
        }
        this.senderId = senderId;
        this.color = color;
        this.role = role;
        this.clusterId = clusterId;
    }

    @Override
    public PacketKind getKind() {
        return PacketKind.ADVERTISEMENT;
    }

    public int getSenderId() {
        return senderId;
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

    @Override
    public String toString() {
        return "Advertisement{sender=" + senderId + ", color=" + color + ", role=" + role
                + ", clusterId=" + clusterId + "}";
    }

}
