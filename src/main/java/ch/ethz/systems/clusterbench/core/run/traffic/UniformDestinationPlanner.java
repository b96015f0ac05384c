package ch.ethz.systems.clusterbench.core.run.traffic;

import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IDestinationSelector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Picks the destination of every synthetic data unit uniformly at
 * random among all other nodes, or always the same fixed node.
 */
public class UniformDestinationPlanner implements IDestinationSelector {

    /**
     * Configuration value of a fixed destination that selects uniform random destinations.
     */
    public static final int RANDOM_DESTINATION = -1;

    private final List<Integer> nodeIdList;
    private final int fixedDestination;
    private final Random rng;

    /**
     * @param nodeIds           Identifiers of all nodes
     * @param fixedDestination  Destination for every unit, or {@link #RANDOM_DESTINATION}
     * @param rng               Randomness for destination draws
     */
    public UniformDestinationPlanner(Collection<Integer> nodeIds, int fixedDestination, Random rng) {
        this.nodeIdList = new ArrayList<>(nodeIds);
        this.nodeIdList.sort(Integer::compareTo);
        if (fixedDestination != RANDOM_DESTINATION && !nodeIdList.contains(fixedDestination)) {
            throw new IllegalArgumentException("Fixed destination " + fixedDestination + " is not a node");
        }
        this.fixedDestination = fixedDestination;
        this.rng = rng;
    }

    @Override
    public int selectDestination(int sourceId) {
        if (fixedDestination != RANDOM_DESTINATION) {
            return fixedDestination == sourceId ? NO_DESTINATION : fixedDestination;
        }
        if (nodeIdList.size() < 2) {
            return NO_DESTINATION;
        }

        // Draw among all nodes except the source
        int sourceIndex = nodeIdList.indexOf(sourceId);
        if (sourceIndex < 0) {
            return nodeIdList.get(rng.nextInt(nodeIdList.size()));
        }
        int index = rng.nextInt(nodeIdList.size() - 1);
        return nodeIdList.get(index >= sourceIndex ? index + 1 : index);
    }

}
