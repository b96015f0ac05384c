package ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet;

/**
 * Best-effort application data unit. Immutable: every hop works on a copy
 * created by {@link #forwardCopy()} and {@link #withNextHop(int)}.
 */
public class DataUnitPacket extends GccPacket {

    /**
     * Value of the explicit next hop when the unit is not addressed to a specific neighbor.
     */
    public static final int NO_NEXT_HOP = -1;

    // sourceId, sequenceNumber, ttl, destinationId, explicitNextHopId: 5 x 32 bit, creation time: 64 bit
    private static final long HEADER_SIZE_BIT = 5 * 32 + 64;

    public static final int FILLER_SIZE_BYTE = 100;

    private final int sourceId;
    private final int sequenceNumber;
    private final int timeToLive;
    private final int destinationId;
    private final int explicitNextHopId;
    private final long creationTimeNs;

    public DataUnitPacket(int sourceId, int sequenceNumber, int timeToLive, int destinationId,
                          int explicitNextHopId, long creationTimeNs) {
        super(HEADER_SIZE_BIT + FILLER_SIZE_BYTE * 8L);
        this.sourceId = sourceId;
        this.sequenceNumber = sequenceNumber;
        this.timeToLive = timeToLive;
        this.destinationId = destinationId;
        this.explicitNextHopId = explicitNextHopId;
        this.creationTimeNs = creationTimeNs;
    }

    /**
     * @return Copy for relaying: time-to-live one less, next hop unset
     */
    public DataUnitPacket forwardCopy() {
        return new DataUnitPacket(sourceId, sequenceNumber, timeToLive - 1, destinationId,
                NO_NEXT_HOP, creationTimeNs);
    }

    /**
     * @param nextHopId     Neighbor the copy is addressed to
     *
     * @return Copy with the explicit next hop set, time-to-live unchanged
     */
    public DataUnitPacket withNextHop(int nextHopId) {
        return new DataUnitPacket(sourceId, sequenceNumber, timeToLive, destinationId,
                nextHopId, creationTimeNs);
    }

    @Override
    public PacketKind getKind() {
        return PacketKind.DATA_UNIT;
    }

    public boolean hasExplicitNextHop() {
        return explicitNextHopId != NO_NEXT_HOP;
    }

    public int getSourceId() {
        return sourceId;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    public int getTimeToLive() {
        return timeToLive;
    }

    public int getDestinationId() {
        return destinationId;
    }

    public int getExplicitNextHopId() {
        return explicitNextHopId;
    }

    public long getCreationTimeNs() {
        return creationTimeNs;
    }

    @Override
    public String toString() {
        return "DataUnit{src=" + sourceId + ", seq=" + sequenceNumber + ", ttl=" + timeToLive
                + ", dst=" + destinationId + ", nextHop=" + explicitNextHopId + ", created=" + creationTimeNs + "}";
    }

}
