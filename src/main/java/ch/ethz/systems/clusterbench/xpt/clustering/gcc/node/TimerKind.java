package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

/**
 * Self-timers of a node.
 */
public enum TimerKind {

    /** Periodic advertisement of the local state. */
    ADVERTISEMENT,

    /** One-shot initial coloring shortly after start (legacy, maintenance recolors as well). */
    INITIAL_COLORING,

    /** Periodic prune, recolor and role resolution. */
    MAINTENANCE,

    /** Periodic origination of a synthetic data unit. */
    DATA_GENERATION
}
