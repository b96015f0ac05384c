package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

/**
 * Why a data unit was not delivered or forwarded any further.
 */
public enum DropReason {

    /** Explicit next hop is another node (overheard copy). */
    ADDRESSING_MISS(true),

    /** (source, sequence number) already processed. */
    DUPLICATE(true),

    /** Members and Undecided nodes never relay transit traffic. */
    NOT_A_FORWARDER(false),

    /** Time-to-live exhausted. */
    TTL_EXPIRED(false),

    /** No reachable Cluster Head for an uplink. */
    ORPHANED(false),

    /** Backbone node without any neighbor to relay to. */
    NO_ROUTE(false),

    /** Target neighbor left the table while a deferred send was pending. */
    VANISHED_NEIGHBOR(false);

    private final boolean silent;

    DropReason(boolean silent) {
        this.silent = silent;
    }

    /**
     * @return True iff the drop is a normal suppression path which is not logged as a warning
     */
    public boolean isSilent() {
        return silent;
    }

}
