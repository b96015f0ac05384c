package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborTable;

import java.util.HashMap;
import java.util.Map;

/**
 * Cluster Head hints: remote node identifier to the Gateway neighbor a data
 * unit of that node last arrived from. Learned passively, evicted lazily
 * once the cached neighbor is gone or no longer a Gateway.
 */
public class RouteCache {

    public static final int NO_ROUTE = -1;

    private final Map<Integer, Integer> destinationToGateway;

    public RouteCache() {
        this.destinationToGateway = new HashMap<>();
    }

    /**
     * Remember that the destination is reachable through the gateway neighbor.
     *
     * @param destinationId     Remote node identifier
     * @param gatewayId         Gateway neighbor identifier
     */
    public void learn(int destinationId, int gatewayId) {
        destinationToGateway.put(destinationId, gatewayId);
    }

    public boolean contains(int destinationId) {
        return destinationToGateway.containsKey(destinationId);
    }

    /**
     * Look up the gateway towards a destination. An entry whose gateway is no
     * longer a Gateway neighbor is removed.
     *
     * @param destinationId     Remote node identifier
     * @param neighborTable     Current neighbor table
     *
     * @return Gateway neighbor identifier, or {@link #NO_ROUTE}
     */
    public int lookupValidGateway(int destinationId, NeighborTable neighborTable) {
        Integer gatewayId = destinationToGateway.get(destinationId);
        if (gatewayId == null) {
            return NO_ROUTE;
        }
        if (!neighborTable.isGateway(gatewayId)) {
            destinationToGateway.remove(destinationId);
            return NO_ROUTE;
        }
        return gatewayId;
    }

    public int size() {
        return destinationToGateway.size();
    }

}
