package ch.ethz.systems.clusterbench.core.network;

/**
 * An event happens at a fixed point in virtual time. Once its time has come,
 * the {@link ch.ethz.systems.clusterbench.core.Simulator simulator} calls
 * {@link #trigger()}, unless the event was cancelled beforehand.
 */
public abstract class Event {

    private final long timeNs;
    private boolean cancelled;

    /**
     * Create an event which will happen at the given absolute virtual time.
     *
     * @param timeNs    Absolute virtual time in nanoseconds
     */
    public Event(long timeNs) {
        this.timeNs = timeNs;
        this.cancelled = false;
    }

    /**
     * Perform the action associated with this event.
     */
    public abstract void trigger();

    /**
     * Prevent the event from being triggered. Cancelling an event
     * that has already been triggered has no effect.
     */
    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public long getTime() {
        return timeNs;
    }

}
