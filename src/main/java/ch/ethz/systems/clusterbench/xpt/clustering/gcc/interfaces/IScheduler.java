package ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces;

import ch.ethz.systems.clusterbench.core.network.Event;

/**
 * Virtual clock and timer service a node runs on. A node never blocks:
 * every delay is expressed as an event registered for a future time.
 */
public interface IScheduler {

    /**
     * @return Current virtual time in nanoseconds (monotonic)
     */
    long now();

    /**
     * Register an event to be triggered at its time. Pending events are
     * withdrawn by {@link Event#cancel() cancelling} them.
     *
     * @param event     Event with an absolute time not before {@link #now()}
     */
    void scheduleAt(Event event);

}
