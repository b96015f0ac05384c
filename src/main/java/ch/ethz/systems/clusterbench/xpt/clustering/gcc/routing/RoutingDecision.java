package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet.DataUnitPacket;

import java.util.Collections;
import java.util.List;

/**
 * What the node has to do with a data unit: hand it to the application,
 * transmit copies of it, or drop it.
 */
public final class RoutingDecision {

    public enum Outcome {
        DELIVER,
        FORWARD,
        DROP
    }

    private final Outcome outcome;
    private final DataUnitPacket unit;
    private final List<Transmission> transmissions;
    private final DropReason dropReason;

    private RoutingDecision(Outcome outcome, DataUnitPacket unit, List<Transmission> transmissions,
                            DropReason dropReason) {
        this.outcome = outcome;
        this.unit = unit;
        this.transmissions = transmissions;
        this.dropReason = dropReason;
    }

    static RoutingDecision deliver(DataUnitPacket unit) {
        return new RoutingDecision(Outcome.DELIVER, unit, Collections.emptyList(), null);
    }

    static RoutingDecision forward(DataUnitPacket unit, List<Transmission> transmissions) {
        return new RoutingDecision(Outcome.FORWARD, unit, Collections.unmodifiableList(transmissions), null);
    }

    static RoutingDecision drop(DataUnitPacket unit, DropReason reason) {
        return new RoutingDecision(Outcome.DROP, unit, Collections.emptyList(), reason);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * @return For DELIVER and DROP the unit as received, for FORWARD the copy to transmit
     *         (time-to-live already decremented when relaying)
     */
    public DataUnitPacket getUnit() {
        return unit;
    }

    public List<Transmission> getTransmissions() {
        return transmissions;
    }

    /**
     * @return Drop reason, or null unless the outcome is DROP
     */
    public DropReason getDropReason() {
        return dropReason;
    }

    @Override
    public String toString() {
        switch (outcome) {
            case FORWARD:
                return "FORWARD" + transmissions;
            case DROP:
                return "DROP(" + dropReason + ")";
            default:
                return "DELIVER";
        }
    }

}
