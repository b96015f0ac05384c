package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

import java.util.HashSet;
import java.util.Set;

/**
 * Greedy, conflict-aware, self-compacting graph coloring under 1-hop visibility.
 *
 * Rules, evaluated in priority order:
 * 1. Conflict: the current color is shared by a neighbor with a smaller
 *    identifier (the smaller identifier always keeps the color).
 * 2. (Re)coloring: uncolored or conflicting nodes take the smallest
 *    non-negative color not used by any neighbor.
 * 3. Cluster Head recovery: a colored node without any color-0 neighbor
 *    claims color 0. Simultaneous claimants are sorted out by rule 1 in
 *    a later round.
 * 4. Compaction: a node with color above 0 moves down to the smallest
 *    color of at least 1 not used by any neighbor, never up.
 *
 * Deterministic: the same table and identifier always give the same color.
 */
public class ColoringEngine {

    /**
     * Color reserved for Cluster Heads.
     */
    public static final int CLUSTER_HEAD_COLOR = 0;

    /**
     * Compute the (possibly unchanged) color of a node.
     *
     * @param nodeId        Identifier of the node
     * @param currentColor  Current color, or {@link NodeState#UNASSIGNED_COLOR}
     * @param table         Neighbor table of the node
     *
     * @return New color
     */
    public int computeColor(int nodeId, int currentColor, NeighborTable table) {
        Set<Integer> usedColors = collectUsedColors(table);

        // Rules 1 & 2
        if (currentColor == NodeState.UNASSIGNED_COLOR || isConflicting(nodeId, currentColor, table)) {
            return smallestFreeColor(usedColors, CLUSTER_HEAD_COLOR);
        }

        // Rule 3
        if (currentColor != CLUSTER_HEAD_COLOR && !usedColors.contains(CLUSTER_HEAD_COLOR)) {
            return CLUSTER_HEAD_COLOR;
        }

        // Rule 4
        if (currentColor > CLUSTER_HEAD_COLOR) {
            int candidate = smallestFreeColor(usedColors, CLUSTER_HEAD_COLOR + 1);
            if (candidate < currentColor) {
                return candidate;
            }
        }

        return currentColor;
    }

    /**
     * @param nodeId        Identifier of the node
     * @param currentColor  Current color of the node
     * @param table         Neighbor table of the node
     *
     * @return True iff a neighbor with a smaller identifier has the same color
     */
    public boolean isConflicting(int nodeId, int currentColor, NeighborTable table) {
        if (currentColor == NodeState.UNASSIGNED_COLOR) {
            return false;
        }
        for (NeighborRecord record : table.snapshot()) {
            if (record.getNeighborId() >= nodeId) {
                break; // Ascending order: no smaller identifier follows
            }
            if (record.getColor() == currentColor) {
                return true;
            }
        }
        return false;
    }

    private static Set<Integer> collectUsedColors(NeighborTable table) {
        Set<Integer> usedColors = new HashSet<>();
        for (NeighborRecord record : table.snapshot()) {
            if (record.getColor() >= 0) {
                usedColors.add(record.getColor());
            }
        }
        return usedColors;
    }

    private static int smallestFreeColor(Set<Integer> usedColors, int lowerBound) {
        int candidate = lowerBound;
        while (usedColors.contains(candidate)) {
            candidate++;
        }
        return candidate;
    }

}
