package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Record of the (source, sequence number) pairs a node has already processed.
 *
 * Unbounded by default. With a positive capacity the oldest record is
 * forgotten first once the capacity is exceeded.
 */
public class DedupSet {

    private final int capacity;
    private final LinkedHashSet<Long> seen;

    /**
     * @param capacity  Maximum number of records kept, 0 for unbounded
     */
    public DedupSet(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Dedup capacity cannot be negative: " + capacity);
        }
        this.capacity = capacity;
        this.seen = new LinkedHashSet<>();
    }

    public DedupSet() {
        this(0);
    }

    /**
     * @return True iff the pair has been recorded before
     */
    public boolean contains(int sourceId, int sequenceNumber) {
        return seen.contains(key(sourceId, sequenceNumber));
    }

    /**
     * Record a pair.
     *
     * @return True iff the pair was not yet recorded
     */
    public boolean add(int sourceId, int sequenceNumber) {
        boolean added = seen.add(key(sourceId, sequenceNumber));
        if (added && capacity > 0 && seen.size() > capacity) {
            Iterator<Long> oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
        return added;
    }

    public int size() {
        return seen.size();
    }

    public int getCapacity() {
        return capacity;
    }

    private static long key(int sourceId, int sequenceNumber) {
        return ((long) sourceId << 32) | (sequenceNumber & 0xFFFFFFFFL);
    }

}
