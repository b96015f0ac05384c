package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

import ch.ethz.systems.clusterbench.core.Simulator;
import ch.ethz.systems.clusterbench.core.network.Event;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IScheduler;

/**
 * Scheduler backed by the discrete-event simulator.
 */
public class SimulatorScheduler implements IScheduler {

    private final Simulator simulator;

    public SimulatorScheduler(Simulator simulator) {
        this.simulator = simulator;
    }

    @Override
    public long now() {
        return simulator.getCurrentTime();
    }

    @Override
    public void scheduleAt(Event event) {
        simulator.registerEvent(event);
    }

}
