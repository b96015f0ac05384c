package ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces;

/**
 * Chooses the destination of a synthetic data unit.
 */
public interface IDestinationSelector {

    /**
     * Value returned when there is nobody to send to.
     */
    int NO_DESTINATION = -1;

    /**
     * @param sourceId  Identifier of the originating node
     *
     * @return Destination node identifier (never the source itself), or {@link #NO_DESTINATION}
     */
    int selectDestination(int sourceId);

}
