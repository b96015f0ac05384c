package ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet;

import ch.ethz.systems.clusterbench.core.network.Packet;

/**
 * Base of all graph-coloring clustering messages.
 */
public abstract class GccPacket extends Packet {

    GccPacket(long sizeBit) {
        super(sizeBit);
    }

    public abstract PacketKind getKind();

}
