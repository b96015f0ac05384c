package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

import ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet.DataUnitPacket;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.Transmission;

/**
 * Jittered transmission of a data unit copy to one neighbor.
 */
class DelayedForwardEvent extends NodeEvent {

    private final DataUnitPacket copy;
    private final Transmission transmission;

    DelayedForwardEvent(long timeNs, GraphColoringNode node, DataUnitPacket copy, Transmission transmission) {
        super(timeNs, node);
        this.copy = copy;
        this.transmission = transmission;
    }

    @Override
    protected void fire() {
        node.transmit(copy, transmission);
    }

    DataUnitPacket getCopy() {
        return copy;
    }

    Transmission getTransmission() {
        return transmission;
    }

}
