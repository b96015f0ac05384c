package ch.ethz.systems.clusterbench.core.network;

/**
 * A packet as seen by the transport and the medium: an opaque unit
 * with a size. Protocols subclass it with their own header fields.
 */
public abstract class Packet {

    private final long sizeBit;

    /**
     * @param sizeBit   Total size of the packet on the medium in bits (header and payload)
     */
    public Packet(long sizeBit) {
        if (sizeBit <= 0) {
            throw new IllegalArgumentException("Packet must not be empty: " + sizeBit + " bits");
        }
        this.sizeBit = sizeBit;
    }

    public long getSizeBit() {
        return sizeBit;
    }

}
