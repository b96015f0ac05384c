package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

import ch.ethz.systems.clusterbench.core.network.Event;

/**
 * Event owned by a node. The node keeps track of its pending events so that
 * it can cancel all of them when it is stopped.
 */
abstract class NodeEvent extends Event {

    protected final GraphColoringNode node;

    NodeEvent(long timeNs, GraphColoringNode node) {
        super(timeNs);
        this.node = node;
    }

    @Override
    public final void trigger() {
        node.onEventFired(this);
        fire();
    }

    protected abstract void fire();

}
