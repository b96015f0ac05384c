package ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet;

/**
 * The two kinds of message the protocol puts on the medium.
 */
public enum PacketKind {
    ADVERTISEMENT,
    DATA_UNIT
}
