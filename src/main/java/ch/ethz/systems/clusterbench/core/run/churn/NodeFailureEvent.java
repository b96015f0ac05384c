package ch.ethz.systems.clusterbench.core.run.churn;

import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.network.Event;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.node.GraphColoringNode;

/**
 * Crash-stop failure of a node: it stops all timers and leaves the medium.
 */
public class NodeFailureEvent extends Event {

    private final GraphColoringNode node;

    /**
     * @param timeNs    Absolute failure time in nanoseconds
     * @param node      Node that fails
     */
    public NodeFailureEvent(long timeNs, GraphColoringNode node) {
        super(timeNs);
        this.node = node;
    }

    @Override
    public void trigger() {
        SimulationLogger.logInfo("NODE_FAILURE", "Node=" + node.getId() + ",Time=" + getTime());
        node.stop();
    }

    public GraphColoringNode getNode() {
        return node;
    }

}
