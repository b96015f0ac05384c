package ch.ethz.systems.clusterbench.core;

import ch.ethz.systems.clusterbench.core.config.NBProperties;
import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.network.Event;

import java.util.PriorityQueue;
import java.util.Random;

/**
 * Discrete-event simulator. Holds the virtual clock and the queue of
 * pending {@link Event events}, and hands out seeded random number
 * generators so that a run is reproducible from its seed.
 *
 * Events with equal time are triggered in the order in which they were
 * registered. The simulator is an ordinary instance: every component
 * that needs the clock gets it passed in.
 */
public class Simulator {

    private final NBProperties configuration;
    private final Random independentSeedRandom;
    private final PriorityQueue<QueuedEvent> eventQueue;

    private long now;
    private long registrationCounter;
    private long triggeredEvents;

    /**
     * Create a simulator at virtual time zero.
     *
     * @param seed              Seed from which all independent randoms are derived
     * @param configuration     Run configuration (may be null in unit tests)
     */
    public Simulator(long seed, NBProperties configuration) {
        this.configuration = configuration;
        this.independentSeedRandom = new Random(seed);
        this.eventQueue = new PriorityQueue<>();
        this.now = 0;
        this.registrationCounter = 0;
        this.triggeredEvents = 0;
    }

    /**
     * Register an event. Events in the past are refused.
     *
     * @param event     Event instance
     */
    public void registerEvent(Event event) {
        if (event.getTime() < now) {
            throw new IllegalArgumentException(
                    "Event scheduled in the past: time=" + event.getTime() + " < now=" + now);
        }
        eventQueue.add(new QueuedEvent(event, registrationCounter++));
    }

    /**
     * Run the simulation for the given amount of virtual time. Events at
     * exactly the end time are still triggered. Afterwards the clock
     * stands at the end time.
     *
     * @param runtimeNs     Virtual time to advance in nanoseconds
     */
    public void runNs(long runtimeNs) {
        long endTime = now + runtimeNs;
        while (!eventQueue.isEmpty() && eventQueue.peek().event.getTime() <= endTime) {
            Event event = eventQueue.poll().event;
            now = event.getTime();
            if (!event.isCancelled()) {
                event.trigger();
                triggeredEvents++;
            }
        }
        now = endTime;
        SimulationLogger.logInfo("SIMULATOR_RUN_FINISHED",
                "Time=" + now + ",TriggeredEvents=" + triggeredEvents + ",PendingEvents=" + eventQueue.size());
    }

    /**
     * Retrieve an independent random number generator. Two runs with the same
     * seed which request randoms in the same order get the same streams.
     *
     * @param name      Name of the consumer (for traceability only)
     *
     * @return Seeded random number generator
     */
    public Random selectIndependentRandom(String name) {
        long seed = independentSeedRandom.nextLong();
        SimulationLogger.logInfo("SIMULATOR_RANDOM_SELECTED", "Name=" + name + ",Seed=" + seed);
        return new Random(seed);
    }

    public long getCurrentTime() {
        return now;
    }

    public NBProperties getConfiguration() {
        return configuration;
    }

    /**
     * @return Number of events still waiting (including cancelled ones)
     */
    public int getPendingEventCount() {
        return eventQueue.size();
    }

    public long getTriggeredEventCount() {
        return triggeredEvents;
    }

    private static final class QueuedEvent implements Comparable<QueuedEvent> {

        private final Event event;
        private final long registration;

        private QueuedEvent(Event event, long registration) {
            this.event = event;
            this.registration = registration;
        }

        @Override
        public int compareTo(QueuedEvent o) {
            int byTime = Long.compare(event.getTime(), o.event.getTime());
            return byTime != 0 ? byTime : Long.compare(registration, o.registration);
        }

    }

}
